package com.warden.identity.forms;

import com.warden.forms.FormDescriptor;

/**
 * Form submitted to {@code POST /user/settings/applications} to issue an access token.
 *
 * @param name display name of the token
 */
public record NewAccessTokenForm(String name) {

    public static final FormDescriptor<NewAccessTokenForm> DESCRIPTOR =
            FormDescriptor.<NewAccessTokenForm>builder("new_access_token")
                    .field("Name", "name", "Required;MaxSize(255)", NewAccessTokenForm::name)
                    .build();
}
