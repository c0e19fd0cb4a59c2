package com.pgbranch.capture.capture;

import com.pgbranch.capture.catalog.TypeDescriptor;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** One captured column: its type as recorded on the source and its text form (null for SQL NULL). */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ColumnValue {

    private final TypeDescriptor type;
    private final String value;
}
