package com.bbthechange.podfeed.repository;

import com.bbthechange.podfeed.model.Pledge;

import java.util.Optional;

public interface PledgeRepository {

    Pledge save(Pledge pledge);

    /**
     * May still return a pledge shortly after it expired: DynamoDB removes expired
     * records in the background.
     */
    Optional<Pledge> findById(Long pledgeId);

    void deleteById(Long pledgeId);
}
