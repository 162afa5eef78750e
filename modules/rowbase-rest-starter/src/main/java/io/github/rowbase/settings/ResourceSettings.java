package io.github.rowbase.settings;

import java.util.Set;

/**
 * Settings of one exposed table: field exclusion, validation strictness and id obfuscation.
 * Immutable.
 */
public final class ResourceSettings {

    private final String tableName;
    private final String excludeFieldPrefix;
    private final Set<String> excludeFields;
    private final Set<String> includeFields;
    private final boolean useDatesAsString;
    private final boolean failOnOversizedValues;
    private final boolean failOnUpdateOnAutoinc;
    private final boolean failOnInsertWithoutKey;
    private final String hashidKey;
    private final int hashidMinLength;
    private final boolean hashidStaticIds;
    private final String hashidDomainId;

    private ResourceSettings(Builder builder) {
        this.tableName = builder.tableName;
        this.excludeFieldPrefix = builder.excludeFieldPrefix;
        this.excludeFields = Set.copyOf(builder.excludeFields);
        this.includeFields = Set.copyOf(builder.includeFields);
        this.useDatesAsString = builder.useDatesAsString;
        this.failOnOversizedValues = builder.failOnOversizedValues;
        this.failOnUpdateOnAutoinc = builder.failOnUpdateOnAutoinc;
        this.failOnInsertWithoutKey = builder.failOnInsertWithoutKey;
        this.hashidKey = builder.hashidKey;
        this.hashidMinLength = builder.hashidMinLength;
        this.hashidStaticIds = builder.hashidStaticIds;
        this.hashidDomainId = builder.hashidDomainId;
    }

    public static Builder builder(String tableName) {
        return new Builder(tableName);
    }

    public String getTableName() {
        return tableName;
    }

    /** Fields whose name starts with this prefix are not exposed, {@code null} for none */
    public String getExcludeFieldPrefix() {
        return excludeFieldPrefix;
    }

    public Set<String> getExcludeFields() {
        return excludeFields;
    }

    /** When not empty, only these fields are exposed */
    public Set<String> getIncludeFields() {
        return includeFields;
    }

    public boolean isUseDatesAsString() {
        return useDatesAsString;
    }

    public boolean isFailOnOversizedValues() {
        return failOnOversizedValues;
    }

    public boolean isFailOnUpdateOnAutoinc() {
        return failOnUpdateOnAutoinc;
    }

    public boolean isFailOnInsertWithoutKey() {
        return failOnInsertWithoutKey;
    }

    /** 32 hex character AES key, {@code null} when ids are not obfuscated */
    public String getHashidKey() {
        return hashidKey;
    }

    public int getHashidMinLength() {
        return hashidMinLength;
    }

    public boolean isHashidStaticIds() {
        return hashidStaticIds;
    }

    public String getHashidDomainId() {
        return hashidDomainId;
    }

    public boolean isHashidEnabled() {
        return hashidKey != null && !hashidKey.isEmpty();
    }

    /**
     * Whether a field survives the exclusion rules.
     */
    public boolean isFieldExposed(String fieldName) {
        if (excludeFieldPrefix != null && !excludeFieldPrefix.isEmpty() && fieldName.startsWith(excludeFieldPrefix)) {
            return false;
        }
        if (excludeFields.contains(fieldName)) {
            return false;
        }
        return includeFields.isEmpty() || includeFields.contains(fieldName);
    }

    public static final class Builder {
        private final String tableName;
        private String excludeFieldPrefix;
        private Set<String> excludeFields = Set.of();
        private Set<String> includeFields = Set.of();
        private boolean useDatesAsString;
        private boolean failOnOversizedValues;
        private boolean failOnUpdateOnAutoinc;
        private boolean failOnInsertWithoutKey;
        private String hashidKey;
        private int hashidMinLength = 12;
        private boolean hashidStaticIds;
        private String hashidDomainId = "";

        private Builder(String tableName) {
            this.tableName = tableName;
        }

        public Builder excludeFieldPrefix(String excludeFieldPrefix) {
            this.excludeFieldPrefix = excludeFieldPrefix;
            return this;
        }

        public Builder excludeFields(Set<String> excludeFields) {
            this.excludeFields = excludeFields == null ? Set.of() : excludeFields;
            return this;
        }

        public Builder includeFields(Set<String> includeFields) {
            this.includeFields = includeFields == null ? Set.of() : includeFields;
            return this;
        }

        public Builder useDatesAsString(boolean useDatesAsString) {
            this.useDatesAsString = useDatesAsString;
            return this;
        }

        public Builder failOnOversizedValues(boolean failOnOversizedValues) {
            this.failOnOversizedValues = failOnOversizedValues;
            return this;
        }

        public Builder failOnUpdateOnAutoinc(boolean failOnUpdateOnAutoinc) {
            this.failOnUpdateOnAutoinc = failOnUpdateOnAutoinc;
            return this;
        }

        public Builder failOnInsertWithoutKey(boolean failOnInsertWithoutKey) {
            this.failOnInsertWithoutKey = failOnInsertWithoutKey;
            return this;
        }

        public Builder hashid(String key, int minLength, boolean staticIds, String domainId) {
            this.hashidKey = key;
            this.hashidMinLength = minLength;
            this.hashidStaticIds = staticIds;
            this.hashidDomainId = domainId == null ? "" : domainId;
            return this;
        }

        public ResourceSettings build() {
            if (tableName == null || tableName.isEmpty()) {
                throw new IllegalArgumentException("Resource needs a table name");
            }
            return new ResourceSettings(this);
        }
    }
}
