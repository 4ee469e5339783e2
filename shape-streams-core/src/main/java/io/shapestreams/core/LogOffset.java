package io.shapestreams.core;

/**
 * Position of an item inside a shape log.
 *
 * <p>An offset is the pair {@code (txSeq, opSeq)}: the upstream transaction sequence and the
 * index of the operation within that transaction. Offsets are totally ordered lexicographically
 * and serialize as {@code <txSeq>_<opSeq>}.
 *
 * <p>Two sentinels exist:
 * <ul>
 *   <li>{@link #BEFORE_ALL} (serialized {@code -1}) asks for a fresh snapshot</li>
 *   <li>{@link #FIRST} (serialized {@code 0_0}) is the offset shared by every snapshot row</li>
 * </ul>
 */
public final class LogOffset implements Comparable<LogOffset> {

    public static final LogOffset BEFORE_ALL = new LogOffset(-1L, 0);
    public static final LogOffset FIRST = new LogOffset(0L, 0);

    private final long txSeq;
    private final int opSeq;

    private LogOffset(long txSeq, int opSeq) {
        this.txSeq = txSeq;
        this.opSeq = opSeq;
    }

    /**
     * Offset of the {@code opSeq}-th operation of upstream transaction {@code txSeq}.
     */
    public static LogOffset of(long txSeq, int opSeq) {
        if (txSeq < 0) throw new IllegalArgumentException("txSeq must be >= 0");
        if (opSeq < 0) throw new IllegalArgumentException("opSeq must be >= 0");
        return new LogOffset(txSeq, opSeq);
    }

    /**
     * Parses the wire form ({@code -1} or {@code <tx>_<op>}).
     *
     * @throws ShapeStreamsException.InvalidOffset if the token is malformed
     */
    public static LogOffset parse(String token) {
        if (token == null || token.isEmpty()) {
            throw new ShapeStreamsException.InvalidOffset("offset must not be empty");
        }
        if (Protocol.OFFSET_BEFORE_ALL.equals(token)) return BEFORE_ALL;

        int sep = token.indexOf('_');
        if (sep <= 0 || sep == token.length() - 1) {
            throw new ShapeStreamsException.InvalidOffset("has invalid format");
        }
        String tx = token.substring(0, sep);
        String op = token.substring(sep + 1);
        if (!isDigits(tx) || !isDigits(op)) {
            throw new ShapeStreamsException.InvalidOffset("has invalid format");
        }
        try {
            return of(Long.parseLong(tx), Integer.parseInt(op));
        } catch (NumberFormatException e) {
            throw new ShapeStreamsException.InvalidOffset("has invalid format");
        }
    }

    public long txSeq() {
        return txSeq;
    }

    public int opSeq() {
        return opSeq;
    }

    public boolean isBeforeAll() {
        return txSeq < 0;
    }

    public boolean isAfter(LogOffset other) {
        return compareTo(other) > 0;
    }

    private static boolean isDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    @Override
    public int compareTo(LogOffset o) {
        int c = Long.compare(txSeq, o.txSeq);
        return c != 0 ? c : Integer.compare(opSeq, o.opSeq);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof LogOffset)) return false;
        LogOffset o = (LogOffset) other;
        return txSeq == o.txSeq && opSeq == o.opSeq;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(txSeq) * 31 + opSeq;
    }

    @Override
    public String toString() {
        if (isBeforeAll()) return Protocol.OFFSET_BEFORE_ALL;
        return txSeq + "_" + opSeq;
    }
}
