package com.bluecodes.common.document;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.index.Indexed;

import java.util.List;

@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
class SampleDocument extends BaseDocument {

    @Indexed(unique = true)
    private String code;

    private String group;
    private int price;
    private boolean assigned;
    private String owner;
    private SampleStatus status;
    private List<String> tags;

    SampleDocument(String code, String group, int price) {
        this.code = code;
        this.group = group;
        this.price = price;
        this.status = SampleStatus.OPEN;
        this.tags = List.of();
    }

    enum SampleStatus { OPEN, CLOSED }
}
