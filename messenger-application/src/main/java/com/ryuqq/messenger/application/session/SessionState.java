package com.ryuqq.messenger.application.session;

/**
 * 연결 세션 상태.
 *
 * <pre>
 * UNAUTHENTICATED --(RequestUsername 성공)--&gt; AUTHENTICATED
 * </pre>
 *
 * <p>AUTHENTICATED는 연결이 끊길 때까지 유지됩니다.</p>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
public enum SessionState {

    /** 초기 상태: RequestUsername만 처리. */
    UNAUTHENTICATED,

    /** 로그인 완료: 모든 요청 처리. */
    AUTHENTICATED;

    /**
     * 주어진 상태에서 요청 종류를 처리할 수 있는지 확인.
     *
     * @param isLoginRequest RequestUsername 여부
     * @return 처리 가능하면 true
     */
    public boolean accepts(boolean isLoginRequest) {
        return this == AUTHENTICATED ? !isLoginRequest : isLoginRequest;
    }
}
