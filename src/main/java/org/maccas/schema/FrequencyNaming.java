package org.maccas.schema;

import java.util.List;

/**
 * Where a catalogue puts the frequency tag in column names.
 */
public enum FrequencyNaming {
    NONE {
        @Override
        public List<String> taggedNames(String column, String frequency) {
            return List.of();
        }
    },
    PREFIX {
        @Override
        public List<String> taggedNames(String column, String frequency) {
            return List.of(frequency + "_" + column, frequency + column);
        }
    },
    SUFFIX {
        @Override
        public List<String> taggedNames(String column, String frequency) {
            return List.of(column + "_" + frequency, column + frequency);
        }
    };

    /**
     * Frequency-tagged spellings of {@code column}, in lookup order (underscore form first).
     */
    public abstract List<String> taggedNames(String column, String frequency);
}
