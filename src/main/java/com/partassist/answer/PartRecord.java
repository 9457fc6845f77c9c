package com.partassist.answer;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PartRecord(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("part_number") String partNumber,
        @JsonProperty("model_compatibility") List<String> modelCompatibility,
        @JsonProperty("installation") String installation,
        @JsonProperty("image_url") String imageUrl) implements AnswerPayload {

    public PartRecord {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Part record name must not be blank");
        }
        description = description == null ? "" : description;
        modelCompatibility = modelCompatibility == null ? List.of() : List.copyOf(modelCompatibility);
    }

    @Override
    public String contextText() {
        StringBuilder builder = new StringBuilder(name);
        if (partNumber != null && !partNumber.isBlank()) {
            builder.append(" (").append(partNumber).append(')');
        }
        if (!description.isBlank()) {
            builder.append(": ").append(description);
        }
        if (!modelCompatibility.isEmpty()) {
            builder.append(" Compatible models: ").append(String.join(", ", modelCompatibility)).append('.');
        }
        if (installation != null && !installation.isBlank()) {
            builder.append(" Installation: ").append(installation);
        }
        return builder.toString();
    }
}
