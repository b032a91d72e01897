package co.stubgen.generators.python;

/**
 * Kind of the most recent top-level declaration written to a stub. Drives blank-line
 * placement between declarations.
 */
enum FormattingState {
    EMPTY,
    FUNCTION,
    CLASS,
    EMPTY_CLASS,
    VARIABLE
}
