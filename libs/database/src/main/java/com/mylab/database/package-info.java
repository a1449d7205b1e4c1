/**
 * Database support for the MyLab platform: Flyway wiring and the lab schema migrations under
 * {@code db/migration/lab}.
 */
package com.mylab.database;
