package com.kmg.dms.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Classification metadata of a document. Known keys live in {@code fields}; anything without a
 * {@link Key} goes to the unstructured {@code extra} map.
 */
public final class DocumentMetadata {

    public enum Key {
        ORIGINAL_PATH("original_path"),
        TENANT_CODE("tenant_code"),
        MONTH_FOLDER("month_folder"),
        DOC_TYPE("doc_type"),
        DOC_TYPE_DESCRIPTION("doc_type_description"),
        CATEGORY_CODE("category_code"),
        SUBJECT_SPECIFIC("subject_specific"),
        NEEDS_REVIEW("needs_review"),
        SPLIT_FROM("split_from"),
        SPLIT_FROM_DOCUMENT("split_from_document"),
        PAGES_IN_SPLIT("pages_in_split"),
        SUBJECT_ID_FROM_CODE("subject_id_from_code"),
        CODES_FOUND("codes_found"),
        CODE_SUBJECT_IDS("code_subject_ids"),
        CODE_TENANT_HINT("code_tenant_hint"),
        CODE_USERNAME("code_username"),
        CODE_EFFECTIVE_DATE("code_effective_date"),
        CODE_PERIOD("code_period"),
        CODE_YEAR("code_year"),
        CODE_ERROR("code_error"),
        MATCHED_RULE("matched_rule"),
        PROCESSED_AT("processed_at");

        private final String jsonName;

        Key(String jsonName) {
            this.jsonName = jsonName;
        }

        public String jsonName() {
            return jsonName;
        }

        static Optional<Key> fromJsonName(String name) {
            for (Key key : values()) {
                if (key.jsonName.equals(name)) {
                    return Optional.of(key);
                }
            }
            return Optional.empty();
        }
    }

    private final Map<String, String> fields = new TreeMap<>();
    private final Map<String, Object> extra = new TreeMap<>();

    public DocumentMetadata() {
    }

    @JsonCreator
    public static DocumentMetadata of(
            @JsonProperty("fields") Map<String, String> fields,
            @JsonProperty("extra") Map<String, Object> extra
    ) {
        DocumentMetadata metadata = new DocumentMetadata();
        if (fields != null) {
            fields.forEach((name, value) -> {
                Optional<Key> key = Key.fromJsonName(name);
                if (key.isPresent()) {
                    metadata.put(key.get(), value);
                } else {
                    metadata.putExtra(name, value);
                }
            });
        }
        if (extra != null) {
            extra.forEach(metadata::putExtra);
        }
        return metadata;
    }

    public DocumentMetadata put(Key key, Object value) {
        if (value == null) {
            fields.remove(key.jsonName());
        } else {
            fields.put(key.jsonName(), String.valueOf(value));
        }
        return this;
    }

    public Optional<String> get(Key key) {
        return Optional.ofNullable(fields.get(key.jsonName()));
    }

    public DocumentMetadata putExtra(String name, Object value) {
        if (value == null) {
            extra.remove(name);
        } else {
            extra.put(name, value);
        }
        return this;
    }

    public DocumentMetadata merge(DocumentMetadata other) {
        fields.putAll(other.fields);
        extra.putAll(other.extra);
        return this;
    }

    public DocumentMetadata copy() {
        return new DocumentMetadata().merge(this);
    }

    @JsonProperty("fields")
    public Map<String, String> fields() {
        return Collections.unmodifiableMap(fields);
    }

    @JsonProperty("extra")
    public Map<String, Object> extra() {
        return Collections.unmodifiableMap(extra);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocumentMetadata other)) {
            return false;
        }
        return fields.equals(other.fields) && extra.equals(other.extra);
    }

    @Override
    public int hashCode() {
        return 31 * fields.hashCode() + extra.hashCode();
    }

    @Override
    public String toString() {
        return "DocumentMetadata{fields=" + fields + ", extra=" + extra + '}';
    }
}
