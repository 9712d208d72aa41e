package moonfmt.lang;

/**
 * Settings of one formatting call.
 *
 * @param version       language version flag; from {@value Operators#BITWISE_VERSION}
 *                      on, the bitwise and floor division operators are accepted
 * @param stripComments drop comments instead of carrying them over
 * @param traceTokens   log every reduced token at DEBUG level
 */
public record Options(int version, boolean stripComments, boolean traceTokens) {

    public static Options defaults() {
        return new Options(1, false, false);
    }

    public Options withVersion(int version) {
        return new Options(version, stripComments, traceTokens);
    }

    public Options withStripComments(boolean stripComments) {
        return new Options(version, stripComments, traceTokens);
    }

    public Options withTraceTokens(boolean traceTokens) {
        return new Options(version, stripComments, traceTokens);
    }
}
