package com.challenges.stagedb.predicate;

public enum Combinator {
    AND,
    OR
}
