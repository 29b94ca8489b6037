package com.tessera.database.adapter;

/** How a predicate joins the predicates before it. AND binds tighter than OR. */
public enum BooleanOperator {
    AND,
    OR
}
