package com.libragraph.unwrap.core.output;

import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Types;

import static org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName.BINARY;
import static org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName.FIXED_LEN_BYTE_ARRAY;
import static org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName.INT64;

/**
 * Parquet schema of the output table: one row per leaf, five required columns.
 */
public final class LeafSchema {

    public static final String SOURCE = "source";
    public static final String PATH = "path";
    public static final String SIZE = "size";
    public static final String CONTENT = "content";
    public static final String HASH = "hash";

    public static final int HASH_LENGTH = 32;

    public static final MessageType SCHEMA = Types.buildMessage()
            .required(BINARY).as(LogicalTypeAnnotation.stringType()).named(SOURCE)
            .required(BINARY).as(LogicalTypeAnnotation.stringType()).named(PATH)
            .required(INT64).as(LogicalTypeAnnotation.intType(64, false)).named(SIZE)
            .required(BINARY).named(CONTENT)
            .required(FIXED_LEN_BYTE_ARRAY).length(HASH_LENGTH).named(HASH)
            .named("leaf_entry");

    private LeafSchema() {
    }
}
