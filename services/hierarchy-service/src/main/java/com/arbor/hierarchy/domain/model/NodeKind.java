package com.arbor.hierarchy.domain.model;

/**
 * Semantic label of a node. Has no structural effect: any kind may parent any kind.
 */
public enum NodeKind {

    /** Top-level organization, usually the tenant root. */
    ROOT_CLASS,

    BUSINESS_UNIT,

    DEPARTMENT
}
