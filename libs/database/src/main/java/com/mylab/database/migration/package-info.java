/**
 * Flyway configuration and migration status reporting.
 */
package com.mylab.database.migration;
