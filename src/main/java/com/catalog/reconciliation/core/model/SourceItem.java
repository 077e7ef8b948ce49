package com.catalog.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * One provider's normalized view of one item.
 * The {@code raw} payload is kept for display and audit only; resolution and diffing
 * never look at it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceItem(
        Provider sourceId,
        String sourceItemId,
        String name,
        String type,
        String rarity,
        Double value,
        Double weight,
        List<RecipePart> inputs,
        List<RecipePart> outputs,
        JsonNode raw
) {
    public SourceItem {
        Objects.requireNonNull(sourceId, "sourceId is required");
        inputs = inputs != null ? List.copyOf(inputs) : null;
        outputs = outputs != null ? List.copyOf(outputs) : null;
    }

    public static Builder builder(Provider sourceId) {
        return new Builder(sourceId);
    }

    public static class Builder {
        private final Provider sourceId;
        private String sourceItemId;
        private String name;
        private String type;
        private String rarity;
        private Double value;
        private Double weight;
        private List<RecipePart> inputs;
        private List<RecipePart> outputs;
        private JsonNode raw;

        private Builder(Provider sourceId) {
            this.sourceId = sourceId;
        }

        public Builder sourceItemId(String sourceItemId) {
            this.sourceItemId = sourceItemId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder rarity(String rarity) {
            this.rarity = rarity;
            return this;
        }

        public Builder value(Double value) {
            this.value = value;
            return this;
        }

        public Builder weight(Double weight) {
            this.weight = weight;
            return this;
        }

        public Builder inputs(List<RecipePart> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(List<RecipePart> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder raw(JsonNode raw) {
            this.raw = raw;
            return this;
        }

        public SourceItem build() {
            return new SourceItem(sourceId, sourceItemId, name, type, rarity, value, weight,
                    inputs, outputs, raw);
        }
    }
}
