package com.marianbastiurea.parking.domain.repository;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.model.SimulationRecord;
import com.marianbastiurea.parking.persistence.nosql.SimulationRecordEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import java.util.List;

@Repository
@ConditionalOnProperty(name = "app.dynamo.enabled", havingValue = "true")
public class SimulationRecordDynamoRepository implements SimulationRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(SimulationRecordDynamoRepository.class);
    private final DynamoDbTable<SimulationRecordEntity> table;

    public SimulationRecordDynamoRepository(
            DynamoDbEnhancedClient enhanced,
            @Value("${dynamodb.tables.simulation-runs:simulation_runs}") String tableName
    ) {
        this.table = enhanced.table(tableName, TableSchema.fromBean(SimulationRecordEntity.class));
        log.info("DynamoDB table bound: {}", tableName);

        try {
            table.describeTable();
        } catch (ResourceNotFoundException e) {
            log.error("DynamoDB table '{}' not found in the configured region. Create it or fix the name.", tableName);
        }
    }

    @Override
    public String save(SimulationRecord record) {
        SimulationRecordEntity entity = SimulationRecordEntity.from(record);
        table.putItem(entity);
        log.info("dynamo.putItem ok | pk={} sk={} vehicles={}", entity.getPk(), entity.getSk(), record.totalVehicles());
        return entity.getSk();
    }

    @Override
    public List<SimulationRecord> recent(PolicyKind strategy, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                .queryConditional(QueryConditional.keyEqualTo(
                        Key.builder().partitionValue(SimulationRecordEntity.partitionFor(strategy)).build()))
                .scanIndexForward(false)
                .limit(limit)
                .build();
        return table.query(request).items().stream()
                .limit(limit)
                .map(SimulationRecordEntity::toDomain)
                .toList();
    }
}
