package com.evidencelocker.core.application;

import com.evidencelocker.core.domain.Role;

public class NewPrincipalCommand {
    public final String username;
    public final String fullName;
    public final String email;
    public final String password;
    public final Role role;
    public final String badgeNumber;
    public final String department;

    public NewPrincipalCommand(String username, String fullName, String email, String password, Role role,
                               String badgeNumber, String department) {
        this.username = username;
        this.fullName = fullName;
        this.email = email;
        this.password = password;
        this.role = role;
        this.badgeNumber = badgeNumber;
        this.department = department;
    }
}
