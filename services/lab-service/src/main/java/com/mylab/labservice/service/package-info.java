/**
 * Operations of the lab service. Every public method takes the caller's
 * {@link com.mylab.security.LabSecurityContext} explicitly and scopes its work to the caller's
 * workspace, extended only through the access grant ledger.
 */
package com.mylab.labservice.service;
