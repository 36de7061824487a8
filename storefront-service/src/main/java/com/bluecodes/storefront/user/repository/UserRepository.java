package com.bluecodes.storefront.user.repository;

import com.bluecodes.common.document.DocumentQuery;
import com.bluecodes.common.document.DocumentStore;
import com.bluecodes.storefront.user.entity.User;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class UserRepository {

    private final DocumentStore documentStore;

    public String save(User user) {
        return documentStore.create(User.COLLECTION, user);
    }

    public Optional<User> findByEmail(String email) {
        return documentStore.findOne(User.COLLECTION, DocumentQuery.where().eq("email", email), User.class);
    }
}
