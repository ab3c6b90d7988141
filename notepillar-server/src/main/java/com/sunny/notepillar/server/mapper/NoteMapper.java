package com.sunny.notepillar.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.notepillar.server.entity.Note;
import java.time.LocalDateTime;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

/**
 * 笔记Mapper
 * 多字段状态变更均为单条语句，保证原子性
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Mapper
public interface NoteMapper extends BaseMapper<Note> {

    @Select("""
            SELECT id, title, content, is_translated AS translated, original_content, owner_id, version, created_at, updated_at
            FROM notes
            WHERE id = #{id}
              AND owner_id = #{ownerId}
            """)
    Note selectOwned(@Param("id") Long id, @Param("ownerId") Long ownerId);

    @Select("""
            SELECT id, title, content, is_translated AS translated, original_content, owner_id, version, created_at, updated_at
            FROM notes
            WHERE owner_id = #{ownerId}
            ORDER BY id
            LIMIT #{limit} OFFSET #{offset}
            """)
    List<Note> selectByOwner(@Param("ownerId") Long ownerId,
                             @Param("limit") int limit,
                             @Param("offset") int offset);

    /**
     * 内容变更同时回到未翻译状态，title 为空时保持原值
     */
    @Update("""
            UPDATE notes
            SET title = COALESCE(#{title}, title),
                content = #{content},
                is_translated = FALSE,
                original_content = NULL,
                version = version + 1,
                updated_at = #{updatedAt}
            WHERE id = #{id}
              AND owner_id = #{ownerId}
            """)
    int updateContent(@Param("id") Long id,
                      @Param("ownerId") Long ownerId,
                      @Param("title") String title,
                      @Param("content") String content,
                      @Param("updatedAt") LocalDateTime updatedAt);

    @Update("""
            UPDATE notes
            SET title = #{title},
                updated_at = #{updatedAt}
            WHERE id = #{id}
              AND owner_id = #{ownerId}
            """)
    int updateTitle(@Param("id") Long id,
                    @Param("ownerId") Long ownerId,
                    @Param("title") String title,
                    @Param("updatedAt") LocalDateTime updatedAt);

    /**
     * 仅当版本未变且尚未翻译时写入译文
     */
    @Update("""
            UPDATE notes
            SET original_content = #{originalContent},
                content = #{translatedContent},
                is_translated = TRUE,
                version = version + 1,
                updated_at = #{updatedAt}
            WHERE id = #{id}
              AND owner_id = #{ownerId}
              AND version = #{expectedVersion}
              AND is_translated = FALSE
            """)
    int markTranslated(@Param("id") Long id,
                       @Param("ownerId") Long ownerId,
                       @Param("expectedVersion") Integer expectedVersion,
                       @Param("originalContent") String originalContent,
                       @Param("translatedContent") String translatedContent,
                       @Param("updatedAt") LocalDateTime updatedAt);

    @Delete("""
            DELETE FROM notes
            WHERE id = #{id}
              AND owner_id = #{ownerId}
            """)
    int deleteOwned(@Param("id") Long id, @Param("ownerId") Long ownerId);
}
