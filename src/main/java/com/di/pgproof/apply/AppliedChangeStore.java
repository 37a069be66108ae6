package com.di.pgproof.apply;

import java.util.List;
import java.util.Optional;

/**
 * One record per recommendation; saving again replaces the previous record.
 */
public interface AppliedChangeStore {

    void save(AppliedChange change);

    Optional<AppliedChange> find(String recommendationId);

    /** Most recently applied first. */
    List<AppliedChange> findAll();
}
