package com.github.jnthnclt.os.chaining.collections.ch;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders every bucket of a table, one line per bucket:
 * <pre>
 * Hash table, size=4, total=3
 * array[0]-|
 * array[1]-&gt;(key=b,value=2)-&gt;(key=a,value=1)-|
 * ...
 * </pre>
 *
 * @author jonathan.colt
 */
public class CHashPrinter {

    private CHashPrinter() {
    }

    public static List<String> lines(CHash table) throws Exception {
        List<String> lines = new ArrayList<>(table.capacity() + 2);
        lines.add("Hash table, size=" + table.capacity() + ", total=" + table.size());
        StringBuilder line = new StringBuilder();
        for (int bucket = 0; bucket < table.capacity(); bucket++) {
            line.setLength(0);
            line.append("array[").append(bucket).append(']');
            table.streamBucket(bucket, (b, key, value) -> {
                line.append("->(key=").append(key).append(",value=").append(value).append(')');
                return true;
            });
            line.append("-|");
            lines.add(line.toString());
        }
        lines.add("");
        return lines;
    }

    public static void print(CHash table, PrintStream out) throws Exception {
        for (String line : lines(table)) {
            out.println(line);
        }
    }
}
