package com.sunny.notepillar.server.security;

/**
 * 身份复核结果
 *
 * @author Sunny
 * @date 2026-03-04
 */
public record IdentityVerification(Status status, IdentitySummary identity, String reason) {

    public enum Status {
        VERIFIED,
        /**
         * 身份库明确拒绝
         */
        REJECTED,
        /**
         * 超时、网络或存储故障，无法判定
         */
        UNAVAILABLE
    }

    public static IdentityVerification verified(IdentitySummary identity) {
        return new IdentityVerification(Status.VERIFIED, identity, null);
    }

    public static IdentityVerification rejected(String reason) {
        return new IdentityVerification(Status.REJECTED, null, reason);
    }

    public static IdentityVerification unavailable(String reason) {
        return new IdentityVerification(Status.UNAVAILABLE, null, reason);
    }
}
