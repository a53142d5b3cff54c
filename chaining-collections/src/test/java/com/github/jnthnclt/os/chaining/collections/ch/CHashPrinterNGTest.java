package com.github.jnthnclt.os.chaining.collections.ch;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * @author jonathan.colt
 */
public class CHashPrinterNGTest {

    private static final CHasher BY_LENGTH = (key, capacity) -> key.length() % capacity;

    @Test
    public void testLines() throws Exception {
        CHash map = new CHash(4);
        map.put(BY_LENGTH, "a", 1);
        map.put(BY_LENGTH, "b", 2);
        map.put(BY_LENGTH, "cc", 3);

        Assert.assertEquals(CHashPrinter.lines(map), List.of(
            "Hash table, size=4, total=3",
            "array[0]-|",
            "array[1]->(key=b,value=2)->(key=a,value=1)-|",
            "array[2]->(key=cc,value=3)-|",
            "array[3]-|",
            ""));

        Assert.assertEquals(map.size(), 3);
    }

    @Test
    public void testPrint() throws Exception {
        CHash map = new CHash(2);
        map.put(BY_LENGTH, "xy", -5);

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CHashPrinter.print(map, new PrintStream(bytes, true, StandardCharsets.UTF_8));
        String printed = bytes.toString(StandardCharsets.UTF_8);

        Assert.assertTrue(printed.startsWith("Hash table, size=2, total=1"), printed);
        Assert.assertTrue(printed.contains("array[0]->(key=xy,value=-5)-|"), printed);
        Assert.assertTrue(printed.contains("array[1]-|"), printed);
    }
}
