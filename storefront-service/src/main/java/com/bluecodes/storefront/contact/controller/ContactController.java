package com.bluecodes.storefront.contact.controller;

import com.bluecodes.common.dto.ApiResponse;
import com.bluecodes.storefront.contact.dto.ContactRequest;
import com.bluecodes.storefront.contact.dto.ContactResponse;
import com.bluecodes.storefront.contact.service.ContactService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/contact")
@RequiredArgsConstructor
public class ContactController {

    private final ContactService contactService;

    @PostMapping
    public ApiResponse<ContactResponse> submit(@Valid @RequestBody ContactRequest request) {
        return ApiResponse.ok(new ContactResponse(true, contactService.submit(request)));
    }
}
