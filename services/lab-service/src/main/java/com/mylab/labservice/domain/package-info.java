/**
 * Domain model of the lab service: value types, state machines and the exception taxonomy.
 *
 * <p>Sub-packages hold one aggregate each. Nothing here touches Spring or JDBC except Jackson
 * annotations that fix the wire names of enums.
 */
package com.mylab.labservice.domain;
