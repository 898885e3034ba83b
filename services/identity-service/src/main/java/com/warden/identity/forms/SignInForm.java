package com.warden.identity.forms;

import com.warden.forms.FormDescriptor;
import org.springframework.web.bind.annotation.BindParam;

/**
 * Sign-in form submitted to {@code POST /user/login}.
 *
 * @param userName login name ({@code uname})
 * @param password password
 * @param remember "remember me" checkbox; not validated or echoed back
 */
public record SignInForm(
        @BindParam("uname") String userName, String password, Boolean remember) {

    public static final FormDescriptor<SignInForm> DESCRIPTOR =
            FormDescriptor.<SignInForm>builder("sign_in")
                    .field("UserName", "uname", "Required;MaxSize(35)", SignInForm::userName)
                    .field("Password", "password", "Required;MaxSize(255)", SignInForm::password)
                    .ignored("Remember", SignInForm::remember)
                    .build();

    @Override
    public String toString() {
        return "SignInForm[userName=" + userName + "]";
    }
}
