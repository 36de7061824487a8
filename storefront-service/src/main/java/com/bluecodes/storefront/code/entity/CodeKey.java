package com.bluecodes.storefront.code.entity;

import com.bluecodes.common.document.BaseDocument;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 1회용 교환 코드.
 *
 * <p>불변식: {@code assigned == true} 이면 {@code orderId != null}.
 * 두 필드는 항상 한 번의 findAndModify로 같이 바뀐다.</p>
 */
@Document(collection = CodeKey.COLLECTION)
@CompoundIndex(name = "product_available_idx", def = "{'productId': 1, 'assigned': 1, 'createdAt': 1}")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CodeKey extends BaseDocument {

    public static final String COLLECTION = "codekey";

    private String productId;

    @Indexed(unique = true)
    private String code;

    private boolean assigned;
    private String orderId;

    public CodeKey(String productId, String code) {
        this.productId = productId;
        this.code = code;
        this.assigned = false;
        this.orderId = null;
    }
}
