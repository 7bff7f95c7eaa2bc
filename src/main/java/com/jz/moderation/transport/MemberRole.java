package com.jz.moderation.transport;

public enum MemberRole {
    OWNER, ADMINISTRATOR, MEMBER, RESTRICTED, LEFT, BANNED;

    public boolean isAdmin() {
        return this == OWNER || this == ADMINISTRATOR;
    }
}
