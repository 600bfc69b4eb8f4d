package io.synthtools.matcher;

/**
 * The kinds of rule that the matcher supports
 */
public enum MatchType {
    DIRECT,        // string-equal attribute value
    REGEX,         // unanchored regex search in attribute value
    ANY_OF,        // logical OR over sub-rules
    ALL_OF,        // logical AND over sub-rules
    ONE_OF_EACH;   // one object per combination of bound values, selects over a collection

    /**
     * @return true if rules of this type are evaluated against a single object
     */
    public boolean isPredicate() {
        return this != ONE_OF_EACH;
    }
}
