package com.purchasingpower.codegraph.model.extraction;

import com.purchasingpower.codegraph.model.source.FileRecord;

/**
 * Result of extracting one file: either a record or a parse error.
 */
public sealed interface FileOutcome permits FileOutcome.Parsed, FileOutcome.Failed {

    String path();

    static FileOutcome parsed(FileRecord record) {
        return new Parsed(record);
    }

    static FileOutcome failed(String path, String message) {
        return new Failed(new ParseError(path, message));
    }

    record Parsed(FileRecord record) implements FileOutcome {
        @Override
        public String path() {
            return record.getPath();
        }
    }

    record Failed(ParseError error) implements FileOutcome {
        @Override
        public String path() {
            return error.path();
        }
    }
}
