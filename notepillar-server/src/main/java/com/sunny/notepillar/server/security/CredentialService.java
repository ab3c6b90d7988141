package com.sunny.notepillar.server.security;

import java.util.UUID;
import java.util.regex.Pattern;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import com.sunny.notepillar.common.exception.BadRequestException;
import com.sunny.notepillar.server.exception.security.PasswordHashInvalidException;

/**
 * 凭证服务组件
 * 负责密码哈希与校验，哈希算法为Argon2id
 *
 * @author Sunny
 * @date 2026-03-04
 */
@Component
public class CredentialService {

    /**
     * $argon2{id|i|d}$v=N$m=N,t=N,p=N$salt$hash，salt与hash为无填充Base64
     */
    private static final Pattern ARGON2_ENCODING = Pattern.compile(
            "^\\$argon2(id|i|d)\\$(v=\\d+\\$)?m=\\d+,t=\\d+,p=\\d+\\$[A-Za-z0-9+/]+={0,2}\\$[A-Za-z0-9+/]+={0,2}$");

    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public CredentialService(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw new BadRequestException("密码不能为空");
        }
        return passwordEncoder.encode(password);
    }

    /**
     * 密码不匹配返回 false，仅在存储的哈希本身非法时抛出异常
     */
    public boolean verify(String password, String hash) {
        if (hash == null || !ARGON2_ENCODING.matcher(hash).matches()) {
            throw new PasswordHashInvalidException("存储的密码哈希不是合法的Argon2编码");
        }
        if (password == null) {
            return false;
        }
        return passwordEncoder.matches(password, hash);
    }

    /**
     * 用户不存在时执行一次等价的哈希校验，使耗时与密码错误一致，结果恒为 false
     */
    public boolean verifyAgainstDummy(String password) {
        passwordEncoder.matches(password == null ? "" : password, dummyHash);
        return false;
    }
}
