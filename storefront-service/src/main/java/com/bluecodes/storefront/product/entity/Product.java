package com.bluecodes.storefront.product.entity;

import com.bluecodes.common.document.BaseDocument;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 판매 상품 (게임 아이템/코인/스킨 등의 교환 코드 묶음).
 *
 * <p>하드 삭제하지 않는다. 판매 중지는 {@code active=false}로 처리한다.</p>
 */
@Document(collection = Product.COLLECTION)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Product extends BaseDocument {

    public static final String COLLECTION = "product";

    private String title;
    private String game;          // e.g. Fortnite, Roblox, Minecraft, CS2
    private String rewardType;    // e.g. skin, coins, item, bonus
    private String description;
    private List<String> images = new ArrayList<>();
    private int priceCents;       // 최소 통화 단위, 0 이상
    private String currency;
    private boolean active;
    private Set<String> tags = new LinkedHashSet<>();

    @Builder
    public Product(String title, String game, String rewardType, String description,
                   List<String> images, int priceCents, String currency, Boolean active, Set<String> tags) {
        this.title = title;
        this.game = game;
        this.rewardType = rewardType;
        this.description = description;
        this.images = images != null ? new ArrayList<>(images) : new ArrayList<>();
        this.priceCents = priceCents;
        this.currency = currency != null ? currency : "usd";
        this.active = active == null || active;
        this.tags = tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>();
    }
}
