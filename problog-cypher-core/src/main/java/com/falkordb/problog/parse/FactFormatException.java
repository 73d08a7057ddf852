package com.falkordb.problog.parse;

/**
 * Thrown when a fact fragment is not of the form {@code name(args).}.
 */
public final class FactFormatException extends FactSyntaxException {

    private static final long serialVersionUID = 1L;

    /** The offending fragment as it was split from the source. */
    private final String fragment;

    /**
     * Constructs a new FactFormatException.
     *
     * @param message what is wrong with the fragment
     * @param fragment the offending fragment
     */
    public FactFormatException(final String message, final String fragment) {
        super(message + " -> " + fragment);
        this.fragment = fragment;
    }

    /**
     * The fragment that failed to parse.
     *
     * @return the raw fragment
     */
    public String getFragment() {
        return fragment;
    }
}
