package io.xblive.broker.auth;

import io.xblive.broker.Cancellation;
import io.xblive.broker.XboxLiveException;

/**
 * The individual request/response transforms of the credential chain. Implementations are
 * stateless apart from network I/O and never read or write a token store.
 */
public interface TokenExchange {

    DeviceCode requestDeviceCode(Cancellation cancellation) throws XboxLiveException;

    /**
     * @throws io.xblive.broker.AuthorizationDeniedException when the user declined.
     * @throws io.xblive.broker.DeviceCodeExpiredException when the code is no longer valid.
     */
    DeviceCodePoll pollDeviceCode(DeviceCode deviceCode, Cancellation cancellation) throws XboxLiveException;

    OAuthTokens refresh(String refreshToken, Cancellation cancellation) throws XboxLiveException;

    XboxToken userToken(String accessToken, Cancellation cancellation) throws XboxLiveException;

    XboxToken xstsToken(String userToken, String relyingParty, Cancellation cancellation) throws XboxLiveException;

    ServiceToken serviceToken(XboxToken xstsToken, Cancellation cancellation) throws XboxLiveException;
}
