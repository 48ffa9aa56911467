package com.marianbastiurea.parking.domain.repository;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.model.SimulationRecord;
import com.marianbastiurea.parking.persistence.nosql.SimulationRecordEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.pagination.sync.SdkIterable;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.PageIterable;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import java.util.List;

import static com.marianbastiurea.parking.support.Vehicles.NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SimulationRecordDynamoRepositoryTest {

    private DynamoDbTable<SimulationRecordEntity> table;
    private SimulationRecordDynamoRepository repo;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        DynamoDbEnhancedClient enhanced = mock(DynamoDbEnhancedClient.class);
        table = mock(DynamoDbTable.class);
        when(enhanced.table(eq("simulation_runs"), any(TableSchema.class))).thenReturn(table);
        repo = new SimulationRecordDynamoRepository(enhanced, "simulation_runs");
    }

    private static SimulationRecord record(PolicyKind kind) {
        return new SimulationRecord(kind, NOW, 5, 4, 1, 0.8, 0.75, 30L);
    }

    @Test
    void saveWritesOneItemKeyedByStrategyAndTime() {
        String key = repo.save(record(PolicyKind.LEARNED));

        ArgumentCaptor<SimulationRecordEntity> captor = ArgumentCaptor.forClass(SimulationRecordEntity.class);
        verify(table).putItem(captor.capture());
        SimulationRecordEntity item = captor.getValue();
        assertEquals("SIMULATION#LEARNED", item.getPk());
        assertEquals("RUN#" + NOW, item.getSk());
        assertEquals(4, item.getSuccessful());
        assertEquals(0.8, item.getSuccessRate(), 1e-9);
        assertEquals(item.getSk(), key);
    }

    @Test
    @SuppressWarnings("unchecked")
    void recentMapsQueriedItems() {
        PageIterable<SimulationRecordEntity> pages = mock(PageIterable.class);
        SdkIterable<SimulationRecordEntity> items = () -> List.of(
                SimulationRecordEntity.from(record(PolicyKind.RANDOM)),
                SimulationRecordEntity.from(record(PolicyKind.RANDOM))).iterator();
        when(pages.items()).thenReturn(items);
        when(table.query(any(QueryEnhancedRequest.class))).thenReturn(pages);

        List<SimulationRecord> recent = repo.recent(PolicyKind.RANDOM, 1);

        assertEquals(1, recent.size());
        assertEquals(record(PolicyKind.RANDOM), recent.get(0));
    }

    @Test
    @SuppressWarnings("unchecked")
    void missingTableDoesNotPreventStartup() {
        DynamoDbEnhancedClient enhanced = mock(DynamoDbEnhancedClient.class);
        DynamoDbTable<SimulationRecordEntity> missing = mock(DynamoDbTable.class);
        when(enhanced.table(any(String.class), any(TableSchema.class))).thenReturn(missing);
        when(missing.describeTable()).thenThrow(ResourceNotFoundException.builder().message("no table").build());

        assertDoesNotThrow(() -> new SimulationRecordDynamoRepository(enhanced, "absent"));
    }

    @Test
    void nonPositiveLimitSkipsQuery() {
        assertTrue(repo.recent(PolicyKind.SEQUENTIAL, 0).isEmpty());
        verify(table, never()).query(any(QueryEnhancedRequest.class));
    }
}
