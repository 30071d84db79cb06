package com.linkdeck.linkservice.domain.membership;

/**
 * Who to add and with which role. Email wins when both identifiers are given.
 *
 * @param email target email, matched case-insensitively
 * @param userId target provider user id
 * @param role role to assign
 */
public record AddMemberCommand(String email, String userId, String role) {
}
