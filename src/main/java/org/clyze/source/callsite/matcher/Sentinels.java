package org.clyze.source.callsite.matcher;

/**
 * Methods referenced by recompiled Java sources to mark calls. They are
 * never executed: the recompiled classes are only inspected.
 */
public final class Sentinels {
    /** A string constant that does not occur in real programs. */
    public static final String SENTINEL = "callsite-sentinel-4c1e0f7a9d2b83e5";

    private Sentinels() {}

    public static void mark(String sentinel) { }

    public static <T> T after(T value, String sentinel) { return value; }

    public static int after(int value, String sentinel) { return value; }

    public static long after(long value, String sentinel) { return value; }

    public static double after(double value, String sentinel) { return value; }

    public static float after(float value, String sentinel) { return value; }

    public static boolean after(boolean value, String sentinel) { return value; }

    public static char after(char value, String sentinel) { return value; }

    public static byte after(byte value, String sentinel) { return value; }

    public static short after(short value, String sentinel) { return value; }
}
