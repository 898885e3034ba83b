package com.warden.identity.api;

import com.warden.forms.BindingErrors;
import com.warden.forms.FormDescriptor;
import com.warden.forms.FormProjection;
import com.warden.forms.FormValidator;
import com.warden.identity.forms.NewAccessTokenForm;
import com.warden.identity.forms.SignInForm;
import com.warden.identity.forms.SignUpForm;
import com.warden.identity.infrastructure.web.AuthenticationRequiredException;
import com.warden.identity.infrastructure.web.HttpSessionStore;
import com.warden.identity.infrastructure.web.IdentityResolutionFilter;
import com.warden.security.AccessToken;
import com.warden.security.IdentityResolver;
import com.warden.security.NewUser;
import com.warden.security.ResolutionResult;
import com.warden.security.User;
import com.warden.security.UserAlreadyExistsException;
import com.warden.security.UserDirectory;
import com.warden.security.UserNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Account endpoints behind the web UI: sign in, sign up, sign out and access tokens.
 *
 * <p>A rejected form answers {@code 422} with the template data a page would render: the submitted
 * values, {@code HasError}, the {@code Err_<Field>} flag and a localized {@code ErrorMsg}. Password
 * values are never echoed back.
 */
@RestController
@RequestMapping("/user")
public class AccountController {

    private static final Logger log = LoggerFactory.getLogger(AccountController.class);

    static final Set<String> SECRET_FORM_KEYS = Set.of("password", "retype");

    private final UserDirectory directory;
    private final FormProjection projection;

    public AccountController(UserDirectory directory, FormProjection projection) {
        this.directory = directory;
        this.projection = projection;
    }

    @GetMapping
    public IdentityView whoAmI(
            @RequestAttribute(IdentityResolutionFilter.RESULT_ATTRIBUTE) ResolutionResult identity) {
        return IdentityView.of(identity);
    }

    @PostMapping("/login")
    public ResponseEntity<Map<String, Object>> signIn(
            @ModelAttribute SignInForm form, HttpServletRequest request, Locale locale) {
        BindingErrors errors = FormValidator.validate(SignInForm.DESCRIPTOR, form);
        if (!errors.isEmpty()) {
            return rejected(SignInForm.DESCRIPTOR, form, errors, locale);
        }

        User user;
        try {
            user = directory.getUserByName(form.userName());
        } catch (UserNotFoundException e) {
            return rejected(
                    SignInForm.DESCRIPTOR, form, null, "form.username_password_incorrect", locale);
        }
        if (!directory.verifyPassword(user, form.password())) {
            return rejected(
                    SignInForm.DESCRIPTOR, form, null, "form.username_password_incorrect", locale);
        }
        if (!user.active()) {
            return rejected(SignInForm.DESCRIPTOR, form, null, "form.user_not_activated", locale);
        }

        startSession(request, user);
        log.info("User signed in id={}", user.id());
        return ResponseEntity.ok(signedIn(user));
    }

    @PostMapping("/sign_up")
    public ResponseEntity<Map<String, Object>> signUp(
            @ModelAttribute SignUpForm form, HttpServletRequest request, Locale locale) {
        BindingErrors errors = FormValidator.validate(SignUpForm.DESCRIPTOR, form);
        if (!errors.isEmpty()) {
            return rejected(SignUpForm.DESCRIPTOR, form, errors, locale);
        }
        if (!form.passwordsMatch()) {
            return rejected(SignUpForm.DESCRIPTOR, form, "Password", "form.password_not_match", locale);
        }

        User user;
        try {
            user =
                    directory.createUser(
                            new NewUser(form.userName(), form.email(), form.password(), true));
        } catch (UserAlreadyExistsException e) {
            return rejected(SignUpForm.DESCRIPTOR, form, "UserName", "form.username_been_taken", locale);
        }

        startSession(request, user);
        log.info("User registered id={}", user.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(signedIn(user));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> signOut(HttpServletRequest request) {
        new HttpSessionStore(request).delete(IdentityResolver.SESSION_UID_KEY);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/settings/applications")
    public ResponseEntity<?> createAccessToken(
            @RequestAttribute(IdentityResolutionFilter.RESULT_ATTRIBUTE) ResolutionResult identity,
            @ModelAttribute NewAccessTokenForm form,
            Locale locale) {
        User user = identity.userIfPresent().orElseThrow(AuthenticationRequiredException::new);

        BindingErrors errors = FormValidator.validate(NewAccessTokenForm.DESCRIPTOR, form);
        if (!errors.isEmpty()) {
            return rejected(NewAccessTokenForm.DESCRIPTOR, form, errors, locale);
        }

        AccessToken token = directory.createAccessToken(user.id(), form.name());
        log.info("Access token issued id={} uid={}", token.id(), user.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(token);
    }

    private static void startSession(HttpServletRequest request, User user) {
        var session = new HttpSessionStore(request);
        session.renew();
        session.set(IdentityResolver.SESSION_UID_KEY, user.id());
    }

    private static Map<String, Object> signedIn(User user) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("signedIn", true);
        body.put("user", user);
        return body;
    }

    private <F> ResponseEntity<Map<String, Object>> rejected(
            FormDescriptor<F> descriptor, F form, BindingErrors errors, Locale locale) {
        Map<String, Object> data = new LinkedHashMap<>();
        projection.project(descriptor, form, errors, data, locale);
        return unprocessable(data);
    }

    private <F> ResponseEntity<Map<String, Object>> rejected(
            FormDescriptor<F> descriptor, F form, String fieldName, String messageCode, Locale locale) {
        Map<String, Object> data = new LinkedHashMap<>();
        projection.reject(descriptor, form, fieldName, messageCode, data, locale);
        return unprocessable(data);
    }

    private static ResponseEntity<Map<String, Object>> unprocessable(Map<String, Object> data) {
        SECRET_FORM_KEYS.forEach(data::remove);
        return ResponseEntity.unprocessableEntity().body(data);
    }
}
