package com.github.jnthnclt.os.chaining.collections.ch;

import com.github.jnthnclt.os.chaining.log.ChainingLogger;
import com.github.jnthnclt.os.chaining.log.ChainingLoggerFactory;

/**
 * Traces table mutations at debug level.
 *
 * @author jonathan.colt
 */
public class LoggingCHListener implements CHListener {

    private static final ChainingLogger LOG = ChainingLoggerFactory.getLogger();

    public static final LoggingCHListener SINGLETON = new LoggingCHListener(LOG);

    private final ChainingLogger log;

    public LoggingCHListener(ChainingLogger log) {
        this.log = log;
    }

    @Override
    public void inserted(int bucket, String key, int value) {
        log.debug("inserted key:{} value:{} into bucket:{}", key, value, bucket);
    }

    @Override
    public void removed(int bucket, String key, int value) {
        log.debug("removing {} from bucket:{} value:{}", key, bucket, value);
    }

    @Override
    public void notFound(int bucket, String key) {
        log.debug("key {} not found in bucket:{}", key, bucket);
    }

    @Override
    public void cleared(int capacity, int released) {
        log.debug("cleared {} entries across {} buckets", released, capacity);
    }
}
