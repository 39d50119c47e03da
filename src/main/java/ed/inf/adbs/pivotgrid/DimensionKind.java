package ed.inf.adbs.pivotgrid;

/**
 * Enum representing what the values of a dimension stand for.
 * The kind decides how a grid resolves header labels and whether header values
 * can be renamed or created through the external collaborators.
 */
public enum DimensionKind {

    // values are ids of named entities, e.g. objects of a class
    ENTITY,

    // pseudo-dimension whose values are parameter (measure) definitions
    PARAMETER,

    // values are raw index values, displayed as they are and never renamed or created
    INDEX
}
