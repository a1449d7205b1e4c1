/**
 * JDBC repositories over the lab schema. Every query on a soft-deletable table filters on
 * {@code lifecycle = 'ACTIVE'}; workspace scoping is applied by the caller-facing methods.
 */
package com.mylab.labservice.infrastructure.persistence;
