package com.dataset_analyzer.enumeration;

/**
 * What to do with inbound rows whose key set differs from the majority schema.
 * <ul>
 *   <li>REJECT: the whole run fails with a malformed-row error.</li>
 *   <li>DROP: offending rows are removed and counted on the run.</li>
 * </ul>
 */
public enum SchemaPolicy {
    REJECT,
    DROP
}
