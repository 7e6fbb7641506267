package com.bbthechange.podfeed.repository.impl;

import com.bbthechange.podfeed.config.StorageProperties;
import com.bbthechange.podfeed.model.Pledge;
import com.bbthechange.podfeed.repository.PledgeRepository;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.util.Optional;

@Repository
public class PledgeRepositoryImpl implements PledgeRepository {

    private final DynamoDbTable<Pledge> pledgeTable;

    public PledgeRepositoryImpl(DynamoDbEnhancedClient enhancedClient, StorageProperties storageProperties) {
        this.pledgeTable = enhancedClient.table(storageProperties.getPledgesTable(),
                TableSchema.fromBean(Pledge.class));
    }

    @Override
    public Pledge save(Pledge pledge) {
        pledgeTable.putItem(pledge);
        return pledge;
    }

    @Override
    public Optional<Pledge> findById(Long pledgeId) {
        Key key = Key.builder()
                .partitionValue(pledgeId)
                .build();

        return Optional.ofNullable(pledgeTable.getItem(key));
    }

    @Override
    public void deleteById(Long pledgeId) {
        Key key = Key.builder()
                .partitionValue(pledgeId)
                .build();

        pledgeTable.deleteItem(key);
    }
}
