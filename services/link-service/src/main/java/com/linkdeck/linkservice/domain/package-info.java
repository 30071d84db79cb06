/**
 * Domain services of the link service: session validation, audit, memberships, organizations and
 * custom roles.
 *
 * <p>Services here depend on store interfaces declared next to them. JDBC implementations live in
 * {@code infrastructure.persistence}; the authorization rules themselves come from
 * {@code com.linkdeck.security}.
 */
package com.linkdeck.linkservice.domain;
