package com.yumi.pluto.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AllUtilsTest {

    @Test
    public void testCompareSame() {
        byte[] key1Key2 = new byte[] {1, 2, 3, 4};
        int res = AllUtils.compare(key1Key2, key1Key2);
        Assertions.assertEquals(0, res);
    }

    @Test
    public void testCompareNull() {
        byte[] key1OrKey2 = new byte[0];
        Assertions.assertEquals(-1, AllUtils.compare(null, key1OrKey2));
        Assertions.assertEquals(1, AllUtils.compare(key1OrKey2, null));
    }

    @Test
    public void testCompareValueLess() {
        byte[] key1 = new byte[]{1,0,3};
        byte[] key2 = new byte[]{1,2,3};
        Assertions.assertEquals(-2, AllUtils.compare(key1, key2));
    }

    @Test
    public void testCompareLengthLess() {
        byte[] key1 = new byte[]{1,2,3};
        byte[] key2 = new byte[]{1,2,3,4};
        Assertions.assertEquals(-1, AllUtils.compare(key1, key2));
    }

    @Test
    public void testCompareUnsigned() {
        //0xFF 作为无符号数大于 0x01
        byte[] key1 = new byte[]{(byte) 0xFF};
        byte[] key2 = new byte[]{1};
        Assertions.assertTrue(AllUtils.compare(key1, key2) > 0);
        Assertions.assertTrue(AllUtils.compare("hello".getBytes(), "hello1".getBytes()) < 0);
    }

    @Test
    public void testContains() {
        Assertions.assertTrue(AllUtils.contains("a|b".getBytes(), (byte) '|'));
        Assertions.assertFalse(AllUtils.contains("ab".getBytes(), (byte) '|'));
        Assertions.assertFalse(AllUtils.contains(new byte[0], (byte) '|'));
    }

    @Test
    public void testDecimalDigits() {
        Assertions.assertEquals(1, AllUtils.decimalDigits(0));
        Assertions.assertEquals(1, AllUtils.decimalDigits(9));
        Assertions.assertEquals(2, AllUtils.decimalDigits(10));
        Assertions.assertEquals(4, AllUtils.decimalDigits(4096));
        Assertions.assertEquals(10, AllUtils.decimalDigits(Integer.MAX_VALUE));
    }
}
