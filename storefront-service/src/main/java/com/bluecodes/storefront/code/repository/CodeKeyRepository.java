package com.bluecodes.storefront.code.repository;

import com.bluecodes.common.document.DocumentQuery;
import com.bluecodes.common.document.DocumentStore;
import com.bluecodes.common.document.DocumentUpdate;
import com.bluecodes.storefront.code.entity.CodeKey;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class CodeKeyRepository {

    private final DocumentStore documentStore;

    public String save(CodeKey codeKey) {
        return documentStore.create(CodeKey.COLLECTION, codeKey);
    }

    public List<CodeKey> findByCodes(Collection<String> codes) {
        return documentStore.find(CodeKey.COLLECTION,
                DocumentQuery.where().in("code", codes), 0, CodeKey.class);
    }

    /**
     * 미할당 코드 하나를 가장 오래된 것부터 원자적으로 잡아 orderId에 할당한다.
     * 조건({@code assigned:false})과 변경이 한 연산이라 같은 코드를 두 주문이 가져갈 수 없다.
     */
    public Optional<CodeKey> claimOne(String productId, String orderId) {
        return documentStore.findAndModify(CodeKey.COLLECTION,
                DocumentQuery.where()
                        .eq("productId", productId)
                        .eq("assigned", false)
                        .sortBy("createdAt"),
                DocumentUpdate.update()
                        .set("assigned", true)
                        .set("orderId", orderId),
                CodeKey.class);
    }

    // 아직 이 주문이 들고 있는 코드만 되돌린다
    public long release(String orderId, Collection<String> codeIds) {
        return documentStore.updateMany(CodeKey.COLLECTION,
                DocumentQuery.where()
                        .in(DocumentQuery.ID, codeIds)
                        .eq("orderId", orderId),
                DocumentUpdate.update()
                        .set("assigned", false)
                        .set("orderId", null),
                CodeKey.class);
    }

    public long countAvailable(String productId) {
        return documentStore.count(CodeKey.COLLECTION,
                DocumentQuery.where().eq("productId", productId).eq("assigned", false),
                CodeKey.class);
    }
}
