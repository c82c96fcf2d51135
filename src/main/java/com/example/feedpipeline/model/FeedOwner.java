package com.example.feedpipeline.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Feed 所属客户的只读快照（客户数据由外部系统维护）。
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedOwner {

    @Column(name = "customer_id", nullable = false)
    private Long id;

    @Column(name = "customer_username")
    private String username;

    @Column(name = "customer_company")
    private String companyName;

    @Column(name = "customer_email")
    private String email;

    /**
     * 展示名：优先公司名，否则用户名。
     */
    public String displayName() {
        return companyName != null && !companyName.isBlank() ? companyName : username;
    }
}
