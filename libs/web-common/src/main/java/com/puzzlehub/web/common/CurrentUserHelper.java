package com.puzzlehub.web.common;

import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Optional;

/**
 * 当前用户信息提取工具类
 *
 * 认证由外部身份服务完成，本服务只校验 token 并从中读取参与者身份：
 * <pre>
 * {@code
 * @PostMapping("/sessions/{sessionId}/join")
 * public ResponseEntity<?> join(@PathVariable String sessionId, @AuthenticationPrincipal Jwt jwt) {
 *     CurrentUserInfo user = CurrentUserHelper.from(jwt);
 *     service.join(sessionId, user.userId(), user.getDisplayName());
 * }
 * }
 * </pre>
 */
public final class CurrentUserHelper {

    /** 身份服务在 lastName 必填时填入的占位值，展示时去掉 */
    private static final String LASTNAME_PLACEHOLDER = "-";

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 从 JWT token 中提取当前用户信息
     *
     * @param jwt JWT token（从 @AuthenticationPrincipal 注入）
     * @return 当前用户信息，jwt 为 null 时返回 null
     */
    public static CurrentUserInfo from(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        String userId = jwt.getSubject();
        String username = Optional.ofNullable(jwt.getClaimAsString("preferred_username"))
                .filter(s -> !s.isBlank())
                .orElse(userId);
        String nickname = Optional.ofNullable(jwt.getClaimAsString("name"))
                .map(CurrentUserHelper::cleanName)
                .filter(s -> !s.isBlank())
                .orElse(null);
        return new CurrentUserInfo(userId, username, nickname);
    }

    /**
     * 快速获取用户ID
     */
    public static String getUserId(Jwt jwt) {
        return jwt != null ? jwt.getSubject() : null;
    }

    /**
     * 快速获取显示名称
     */
    public static String getDisplayName(Jwt jwt) {
        CurrentUserInfo user = from(jwt);
        return user != null ? user.getDisplayName() : null;
    }

    /**
     * 去掉 name 末尾的占位 lastName："张三 -" → "张三"，"张-三-" → "张-三"
     */
    static String cleanName(String name) {
        String result = name.trim();
        if (result.endsWith(" " + LASTNAME_PLACEHOLDER)) {
            result = result.substring(0, result.length() - 2);
        } else if (result.endsWith(LASTNAME_PLACEHOLDER)) {
            result = result.substring(0, result.length() - 1);
        }
        return result.trim();
    }
}
