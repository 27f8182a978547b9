package amplTransformator;

/**
 * Top-level statement shapes recognized in a .dat file.
 */
public enum StatementKind {
    /** {@code param NAME = value;} on one line. */
    SCALAR_PARAM,
    /** {@code set NAME := e1 e2 ... ;} */
    SET,
    /** {@code param NAME := key value ... ;} */
    INDEXED_PARAM,
    /** {@code param NAME : c1 c2 ... := row v1 v2 ... ;} */
    TABLE_PARAM
}
