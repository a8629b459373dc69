package com.echoboard.realtime.store.client;

import com.echoboard.realtime.model.Role;

public record MemberRequest(
    String userId,
    Role role,
    boolean keepExisting
) {}
