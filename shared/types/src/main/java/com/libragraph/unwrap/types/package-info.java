/**
 * Pure Java value types shared across all unwrap modules.
 *
 * <p>Closed sets of archive and compression kinds produced by format sniffing.
 * ContentHash and buffer types live in {@code shared/utils}.
 */
package com.libragraph.unwrap.types;
