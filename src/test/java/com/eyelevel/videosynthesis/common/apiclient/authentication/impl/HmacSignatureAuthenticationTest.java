package com.eyelevel.videosynthesis.common.apiclient.authentication.impl;

import com.eyelevel.videosynthesis.common.signing.AccessKeyCredentials;
import com.eyelevel.videosynthesis.common.signing.RequestSigner;
import com.eyelevel.videosynthesis.common.signing.SignableRequest;
import com.eyelevel.videosynthesis.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class HmacSignatureAuthenticationTest {

    @Mock
    private RequestSigner requestSigner;

    private final SignableRequest request =
            new SignableRequest("POST", URI.create("https://visual.example.com?Action=CVGetResult"), null, null);

    @Test
    void delegatesToSignerWithConfiguredScope() {
        AccessKeyCredentials credentials = new AccessKeyCredentials("ak", "sk");

        new HmacSignatureAuthentication(requestSigner, credentials, "cn-north-1", "cv").applyAuthentication(request);

        verify(requestSigner).sign(credentials, request, "cn-north-1", "cv");
    }

    @Test
    void incompleteCredentialsFailBeforeSigning() {
        HmacSignatureAuthentication authentication = new HmacSignatureAuthentication(
                requestSigner, new AccessKeyCredentials("ak", null), "cn-north-1", "cv");

        assertThatThrownBy(() -> authentication.applyAuthentication(request))
                .isInstanceOf(ConfigurationException.class);
        verifyNoInteractions(requestSigner);
    }
}
