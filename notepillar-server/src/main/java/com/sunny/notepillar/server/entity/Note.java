package com.sunny.notepillar.server.entity;

import java.time.LocalDateTime;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import lombok.Data;

/**
 * 笔记实体
 * translated 为 true 当且仅当 originalContent 非空
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Data
@TableName("notes")
public class Note {

    @TableId(type = IdType.AUTO)
    private Long id;

    private String title;

    private String content;

    @TableField("is_translated")
    private Boolean translated;

    @TableField("original_content")
    private String originalContent;

    @TableField("owner_id")
    private Long ownerId;

    /**
     * 内容或翻译状态每次写入递增，用于条件更新
     */
    private Integer version;

    @TableField("created_at")
    private LocalDateTime createdAt;

    @TableField("updated_at")
    private LocalDateTime updatedAt;

    public boolean isTranslatedState() {
        return Boolean.TRUE.equals(translated);
    }
}
