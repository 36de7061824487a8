package com.bluecodes.storefront.user.entity;

import com.bluecodes.common.document.BaseDocument;
import com.bluecodes.common.security.Role;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = User.COLLECTION)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User extends BaseDocument {

    public static final String COLLECTION = "user";

    @Indexed(unique = true)
    private String email;

    private String name;
    private String passwordHash;   // BCrypt
    private Role role;

    @Builder
    public User(String email, String name, String passwordHash, Role role) {
        this.email = email;
        this.name = name;
        this.passwordHash = passwordHash;
        this.role = role != null ? role : Role.USER;
    }
}
