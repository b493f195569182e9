package com.flagship.vote_escrow.lock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.vote_escrow.checkpoint.GlobalPoint;
import com.flagship.vote_escrow.checkpoint.UserPoint;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * One checkpoint, global or per position. Bias and slope are WAD-scaled.
 */
@Value
@Builder
public class PointResponse {

    @JsonProperty("epoch")
    int epoch;

    @JsonProperty("bias")
    BigInteger bias;

    @JsonProperty("slope")
    BigInteger slope;

    @JsonProperty("timestamp")
    long timestamp;

    @JsonProperty("block")
    long block;

    @JsonProperty("permanent")
    BigInteger permanent;

    public static PointResponse from(int epoch, GlobalPoint point) {
        return PointResponse.builder()
            .epoch(epoch)
            .bias(point.getBias())
            .slope(point.getSlope())
            .timestamp(point.getTimestamp())
            .block(point.getBlock())
            .permanent(point.getPermanentLockBalance())
            .build();
    }

    public static PointResponse from(int epoch, UserPoint point) {
        return PointResponse.builder()
            .epoch(epoch)
            .bias(point.getBias())
            .slope(point.getSlope())
            .timestamp(point.getTimestamp())
            .block(point.getBlock())
            .permanent(point.getPermanent())
            .build();
    }
}
