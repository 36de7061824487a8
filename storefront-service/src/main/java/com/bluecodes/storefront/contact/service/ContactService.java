package com.bluecodes.storefront.contact.service;

import com.bluecodes.storefront.contact.dto.ContactRequest;
import com.bluecodes.storefront.contact.entity.ContactMessage;
import com.bluecodes.storefront.contact.repository.ContactMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContactService {

    private final ContactMessageRepository contactMessageRepository;

    public String submit(ContactRequest request) {
        String id = contactMessageRepository.save(
                new ContactMessage(request.email(), request.subject(), request.message()));
        log.info("Contact message received: id={}, email={}", id, request.email());
        return id;
    }
}
