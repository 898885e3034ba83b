package com.warden.identity.forms;

import com.warden.forms.FormDescriptor;
import org.springframework.web.bind.annotation.BindParam;

/**
 * Registration form submitted to {@code POST /user/sign_up}.
 *
 * @param userName login name ({@code uname})
 * @param email email address
 * @param password password
 * @param retype password confirmation
 */
public record SignUpForm(
        @BindParam("uname") String userName, String email, String password, String retype) {

    public static final FormDescriptor<SignUpForm> DESCRIPTOR =
            FormDescriptor.<SignUpForm>builder("sign_up")
                    .field("UserName", "uname", "Required;AlphaDashDot;MaxSize(35)", SignUpForm::userName)
                    .field("Email", "email", "Required;Email;MaxSize(50)", SignUpForm::email)
                    .field("Password", "password", "Required;MinSize(6);MaxSize(255)", SignUpForm::password)
                    .field("Retype", "retype", "", SignUpForm::retype)
                    .build();

    public boolean passwordsMatch() {
        return password != null && password.equals(retype);
    }

    @Override
    public String toString() {
        return "SignUpForm[userName=" + userName + ", email=" + email + "]";
    }
}
