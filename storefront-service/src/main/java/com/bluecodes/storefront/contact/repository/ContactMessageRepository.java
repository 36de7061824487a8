package com.bluecodes.storefront.contact.repository;

import com.bluecodes.common.document.DocumentStore;
import com.bluecodes.storefront.contact.entity.ContactMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ContactMessageRepository {

    private final DocumentStore documentStore;

    public String save(ContactMessage message) {
        return documentStore.create(ContactMessage.COLLECTION, message);
    }
}
