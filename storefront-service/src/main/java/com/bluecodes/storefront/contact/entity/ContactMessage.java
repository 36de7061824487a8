package com.bluecodes.storefront.contact.entity;

import com.bluecodes.common.document.BaseDocument;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = ContactMessage.COLLECTION)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ContactMessage extends BaseDocument {

    public static final String COLLECTION = "contact";

    private String email;
    private String subject;
    private String message;

    public ContactMessage(String email, String subject, String message) {
        this.email = email;
        this.subject = subject;
        this.message = message;
    }
}
