package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.speakerverify.domain.BatchItemResult;

import java.util.List;

/**
 * Response of {@code POST /verify_batch}: one entry per candidate, in request order.
 */
public record BatchVerifyResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("reference") String reference,
        @JsonProperty("total") int total,
        @JsonProperty("succeeded") long succeeded,
        @JsonProperty("results") List<Item> results
) {

    public static BatchVerifyResponse from(String reference, List<BatchItemResult> items) {
        List<Item> mapped = items.stream().map(Item::from).toList();
        long ok = items.stream().filter(BatchItemResult::succeeded).count();
        return new BatchVerifyResponse(true, reference, mapped.size(), ok, mapped);
    }

    /**
     * One candidate: its verification result, or an error in place of the result.
     */
    public record Item(
            @JsonProperty("candidate") String candidate,
            @JsonProperty("result") Object result
    ) {
        static Item from(BatchItemResult r) {
            if (r.succeeded()) {
                return new Item(r.candidate(), VerifyResponse.from(r.result()));
            }
            return new Item(r.candidate(), new ItemError(false, r.errorCode(), r.errorMessage()));
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ItemError(
            @JsonProperty("success") boolean success,
            @JsonProperty("error_code") String errorCode,
            @JsonProperty("error") String error
    ) {
    }
}
