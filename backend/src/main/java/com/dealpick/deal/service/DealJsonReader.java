package com.dealpick.deal.service;

import com.dealpick.deal.model.DealRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/**
 * Binds an already-decoded deals payload. Field-level data problems are left for the ranking
 * engine; only a payload that is not an array of objects is rejected.
 */
@Component
public class DealJsonReader {

    private static final Logger log = LoggerFactory.getLogger(DealJsonReader.class);

    private final ObjectMapper objectMapper;

    public DealJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<DealRecord> readDeals(JsonNode payload) {
        if (payload == null || !payload.isArray()) {
            log.warn("Rejected deals payload of type {}", payload == null ? "null" : payload.getNodeType());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Deals payload must be a JSON array");
        }

        List<DealRecord> deals = new ArrayList<>(payload.size());
        for (int i = 0; i < payload.size(); i++) {
            deals.add(bind(payload.get(i), "Deal at index " + i));
        }
        return deals;
    }

    public DealRecord readDeal(JsonNode node) {
        return bind(node, "Deal");
    }

    private DealRecord bind(JsonNode node, String label) {
        if (node == null || !node.isObject()) {
            log.warn("Rejected deal that is not a JSON object ({})", label);
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, label + " must be a JSON object");
        }

        try {
            return objectMapper.treeToValue(node, DealRecord.class);
        } catch (JsonProcessingException exception) {
            log.warn("Rejected deal that could not be bound ({}): {}", label, exception.getOriginalMessage());
            throw new ResponseStatusException(
                HttpStatus.BAD_REQUEST,
                label + " could not be read: " + exception.getOriginalMessage(),
                exception
            );
        }
    }
}
