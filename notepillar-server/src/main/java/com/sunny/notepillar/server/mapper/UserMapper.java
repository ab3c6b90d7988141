package com.sunny.notepillar.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.notepillar.server.entity.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * 用户Mapper
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Mapper
public interface UserMapper extends BaseMapper<User> {

    @Select("""
            SELECT id, username, email, password_hash, is_active AS active, created_at, updated_at
            FROM users
            WHERE username = #{username}
            """)
    User selectByUsername(@Param("username") String username);

    @Select("""
            SELECT id, username, email, password_hash, is_active AS active, created_at, updated_at
            FROM users
            WHERE email = #{email}
            """)
    User selectByEmail(@Param("email") String email);
}
