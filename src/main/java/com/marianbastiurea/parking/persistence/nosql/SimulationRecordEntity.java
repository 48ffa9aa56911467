package com.marianbastiurea.parking.persistence.nosql;

import com.marianbastiurea.parking.domain.enums.PolicyKind;
import com.marianbastiurea.parking.domain.model.SimulationRecord;
import org.springframework.util.Assert;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

import java.time.Instant;

@DynamoDbBean
public class SimulationRecordEntity {

    public static final String PK_PREFIX = "SIMULATION#";
    public static final String SK_PREFIX = "RUN#";

    private String pk;
    private String sk;
    private String strategy;
    private Instant executedAt;
    private Integer totalVehicles;
    private Integer successful;
    private Integer failed;
    private Double successRate;
    private Double averageScore;
    private Long processingMillis;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("pk")
    public String getPk() { return pk; }
    public void setPk(String pk) { this.pk = pk; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sk")
    public String getSk() { return sk; }
    public void setSk(String sk) { this.sk = sk; }

    @DynamoDbAttribute("strategy")
    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    @DynamoDbAttribute("executedAt")
    public Instant getExecutedAt() { return executedAt; }
    public void setExecutedAt(Instant executedAt) { this.executedAt = executedAt; }

    @DynamoDbAttribute("totalVehicles")
    public Integer getTotalVehicles() { return totalVehicles; }
    public void setTotalVehicles(Integer totalVehicles) { this.totalVehicles = totalVehicles; }

    @DynamoDbAttribute("successful")
    public Integer getSuccessful() { return successful; }
    public void setSuccessful(Integer successful) { this.successful = successful; }

    @DynamoDbAttribute("failed")
    public Integer getFailed() { return failed; }
    public void setFailed(Integer failed) { this.failed = failed; }

    @DynamoDbAttribute("successRate")
    public Double getSuccessRate() { return successRate; }
    public void setSuccessRate(Double successRate) { this.successRate = successRate; }

    @DynamoDbAttribute("averageScore")
    public Double getAverageScore() { return averageScore; }
    public void setAverageScore(Double averageScore) { this.averageScore = averageScore; }

    @DynamoDbAttribute("processingMillis")
    public Long getProcessingMillis() { return processingMillis; }
    public void setProcessingMillis(Long processingMillis) { this.processingMillis = processingMillis; }

    public static String partitionFor(PolicyKind strategy) {
        return PK_PREFIX + strategy.name();
    }

    public static SimulationRecordEntity from(SimulationRecord r) {
        Assert.notNull(r, "record");
        Assert.notNull(r.strategy(), "strategy");
        Assert.notNull(r.executedAt(), "executedAt");
        SimulationRecordEntity e = new SimulationRecordEntity();
        e.setPk(partitionFor(r.strategy()));
        e.setSk(SK_PREFIX + r.executedAt());
        e.setStrategy(r.strategy().name());
        e.setExecutedAt(r.executedAt());
        e.setTotalVehicles(r.totalVehicles());
        e.setSuccessful(r.successful());
        e.setFailed(r.failed());
        e.setSuccessRate(r.successRate());
        e.setAverageScore(r.averageScore());
        e.setProcessingMillis(r.processingMillis());
        return e;
    }

    public SimulationRecord toDomain() {
        return new SimulationRecord(
                PolicyKind.valueOf(strategy),
                executedAt,
                totalVehicles == null ? 0 : totalVehicles,
                successful == null ? 0 : successful,
                failed == null ? 0 : failed,
                successRate == null ? 0.0 : successRate,
                averageScore == null ? 0.0 : averageScore,
                processingMillis == null ? 0L : processingMillis
        );
    }
}
