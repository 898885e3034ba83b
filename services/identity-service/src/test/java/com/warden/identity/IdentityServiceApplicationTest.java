package com.warden.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import com.warden.identity.config.IdentityProperties;
import com.warden.identity.infrastructure.web.IdentityResolutionFilter;
import com.warden.security.BasicCredentials;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Integration tests for the identity service, running the full filter chain under the 'test'
 * profile: reverse proxy auth and auto-registration enabled, users alice and bob seeded.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Identity Service Application")
class IdentityServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;
    @Autowired private MeterRegistry meterRegistry;

    private static String uniqueName() {
        return "u" + UUID.randomUUID().toString().substring(0, 8);
    }

    private MockHttpSession signIn(String name, String password) throws Exception {
        var result =
                mockMvc.perform(post("/user/login").param("uname", name).param("password", password))
                        .andExpect(status().isOk())
                        .andReturn();
        return (MockHttpSession) result.getRequest().getSession(false);
    }

    @Test
    @DisplayName("identity properties are loaded from the test profile")
    void propertiesAreLoaded() {
        var props = context.getBean(IdentityProperties.class);

        assertThat(props.enableReverseProxyAuth()).isTrue();
        assertThat(props.seedUsers()).hasSize(2);
    }

    @Test
    @DisplayName("actuator health endpoint is available")
    void actuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }

    @Test
    @DisplayName("correlation ID header is set on responses")
    void correlationIdHeader() throws Exception {
        mockMvc.perform(get("/user"))
                .andExpect(status().isOk())
                .andExpect(result -> assertThat(result.getResponse().getHeader("X-Correlation-ID")).isNotBlank());
    }

    @Test
    @DisplayName("resolutions are counted by mechanism")
    void resolutionsAreCounted() throws Exception {
        mockMvc.perform(get("/user")).andExpect(status().isOk());

        assertThat(
                        meterRegistry
                                .find(IdentityResolutionFilter.RESOLUTIONS_METRIC)
                                .tag("method", "anonymous")
                                .counter())
                .isNotNull();
    }

    @Nested
    @DisplayName("anonymous requests")
    class Anonymous {

        @Test
        @DisplayName("GET /user reports nobody signed in")
        void whoAmI() throws Exception {
            mockMvc.perform(get("/user"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.signedIn").value(false))
                    .andExpect(jsonPath("$.method").value("ANONYMOUS"));
        }

        @Test
        @DisplayName("the API answers 401 with a Basic challenge")
        void apiRequiresAuthentication() throws Exception {
            mockMvc.perform(get("/api/v1/user"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(header().string("WWW-Authenticate", "Basic realm=\"warden\""))
                    .andExpect(jsonPath("$.title").value("Unauthorized"))
                    .andExpect(jsonPath("$.correlationId").exists());
        }

        @Test
        @DisplayName("malformed Authorization headers resolve anonymously")
        void malformedHeaders() throws Exception {
            mockMvc.perform(get("/api/v1/user").header("Authorization", "token"))
                    .andExpect(status().isUnauthorized());
            mockMvc.perform(get("/api/v1/user").header("Authorization", "Basic !!!not-base64"))
                    .andExpect(status().isUnauthorized());
            mockMvc.perform(get("/api/v1/user").header("Authorization", "token a b"))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("creating an access token requires a signed-in user")
        void tokenCreationRequiresUser() throws Exception {
            mockMvc.perform(post("/user/settings/applications").param("name", "ci"))
                    .andExpect(status().isUnauthorized());
        }
    }

    @Nested
    @DisplayName("sign in")
    class SignIn {

        @Test
        @DisplayName("establishes a session that identifies later requests")
        void sessionFlow() throws Exception {
            MockHttpSession session = signIn("alice", "wonderland");

            mockMvc.perform(get("/user").session(session))
                    .andExpect(jsonPath("$.signedIn").value(true))
                    .andExpect(jsonPath("$.user.name").value("alice"))
                    .andExpect(jsonPath("$.method").value("SESSION"));
            mockMvc.perform(get("/api/v1/user").session(session))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value("alice"));
        }

        @Test
        @DisplayName("a wrong password is rejected without flagging a field")
        void wrongPassword() throws Exception {
            mockMvc.perform(post("/user/login").param("uname", "alice").param("password", "guess"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.HasError").value(true))
                    .andExpect(jsonPath("$.ErrorMsg").value("Username or password is not correct."))
                    .andExpect(jsonPath("$.uname").value("alice"))
                    .andExpect(jsonPath("$.password").doesNotExist());
        }

        @Test
        @DisplayName("an unknown user gets the same message as a wrong password")
        void unknownUser() throws Exception {
            mockMvc.perform(post("/user/login").param("uname", "ghost").param("password", "guess"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.ErrorMsg").value("Username or password is not correct."));
        }

        @Test
        @DisplayName("missing fields are projected as a form error")
        void missingFields() throws Exception {
            mockMvc.perform(post("/user/login").param("password", "x"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.Err_UserName").value(true))
                    .andExpect(jsonPath("$.ErrorMsg").value("Username cannot be empty."));
        }

        @Test
        @DisplayName("logout ends the signed-in session")
        void logout() throws Exception {
            MockHttpSession session = signIn("bob", "builder-bob");

            mockMvc.perform(post("/user/logout").session(session)).andExpect(status().isNoContent());

            mockMvc.perform(get("/user").session(session))
                    .andExpect(jsonPath("$.signedIn").value(false));
        }
    }

    @Nested
    @DisplayName("sign up")
    class SignUp {

        @Test
        @DisplayName("creates the user and signs them in")
        void createsUser() throws Exception {
            String name = uniqueName();

            var result =
                    mockMvc.perform(
                                    post("/user/sign_up")
                                            .param("uname", name)
                                            .param("email", name + "@example.com")
                                            .param("password", "secret-pw")
                                            .param("retype", "secret-pw"))
                            .andExpect(status().isCreated())
                            .andExpect(jsonPath("$.user.name").value(name))
                            .andReturn();

            var session = (MockHttpSession) result.getRequest().getSession(false);
            mockMvc.perform(get("/user").session(session))
                    .andExpect(jsonPath("$.user.name").value(name));
        }

        @Test
        @DisplayName("reports the first validation error and never echoes passwords")
        void validationError() throws Exception {
            mockMvc.perform(
                            post("/user/sign_up")
                                    .param("uname", "bad name!")
                                    .param("email", "nope")
                                    .param("password", "secret-pw")
                                    .param("retype", "secret-pw"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.Err_UserName").value(true))
                    .andExpect(jsonPath("$.Err_Email").doesNotExist())
                    .andExpect(
                            jsonPath("$.ErrorMsg")
                                    .value("Username must be valid alpha or numeric or dash(-_) or dot characters."))
                    .andExpect(jsonPath("$.email").value("nope"))
                    .andExpect(jsonPath("$.password").doesNotExist())
                    .andExpect(jsonPath("$.retype").doesNotExist());
        }

        @Test
        @DisplayName("substitutes the minimum size into the message")
        void shortPassword() throws Exception {
            String name = uniqueName();
            mockMvc.perform(
                            post("/user/sign_up")
                                    .param("uname", name)
                                    .param("email", name + "@example.com")
                                    .param("password", "abc")
                                    .param("retype", "abc"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.ErrorMsg").value("Password must contain at least 6 characters."));
        }

        @Test
        @DisplayName("rejects mismatched passwords")
        void passwordMismatch() throws Exception {
            String name = uniqueName();
            mockMvc.perform(
                            post("/user/sign_up")
                                    .param("uname", name)
                                    .param("email", name + "@example.com")
                                    .param("password", "secret-pw")
                                    .param("retype", "other-pw"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.Err_Password").value(true))
                    .andExpect(jsonPath("$.ErrorMsg").value("Password and confirm password are not same."));
        }

        @Test
        @DisplayName("rejects a taken user name")
        void nameTaken() throws Exception {
            mockMvc.perform(
                            post("/user/sign_up")
                                    .param("uname", "alice")
                                    .param("email", "alice2@example.com")
                                    .param("password", "secret-pw")
                                    .param("retype", "secret-pw"))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.Err_UserName").value(true))
                    .andExpect(jsonPath("$.ErrorMsg").value("Username has already been taken."));
        }
    }

    @Nested
    @DisplayName("access tokens")
    class AccessTokens {

        @Test
        @DisplayName("an issued token authenticates API requests only")
        void tokenAuthenticatesApi() throws Exception {
            MockHttpSession session = signIn("alice", "wonderland");
            var created =
                    mockMvc.perform(post("/user/settings/applications").session(session).param("name", "ci"))
                            .andExpect(status().isCreated())
                            .andExpect(jsonPath("$.name").value("ci"))
                            .andReturn();
            String sha = JsonPath.read(created.getResponse().getContentAsString(), "$.sha");

            mockMvc.perform(get("/api/v1/user").header("Authorization", "token " + sha))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value("alice"));
            mockMvc.perform(get("/user").header("Authorization", "token " + sha))
                    .andExpect(jsonPath("$.signedIn").value(false));
        }

        @Test
        @DisplayName("an unknown token is not authenticated")
        void unknownToken() throws Exception {
            mockMvc.perform(get("/api/v1/user").header("Authorization", "token " + "0".repeat(40)))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("a token name is required")
        void nameRequired() throws Exception {
            MockHttpSession session = signIn("alice", "wonderland");

            mockMvc.perform(post("/user/settings/applications").session(session).param("name", ""))
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.Err_Name").value(true))
                    .andExpect(jsonPath("$.ErrorMsg").value("Token name cannot be empty."));
        }
    }

    @Nested
    @DisplayName("Basic and reverse proxy")
    class BasicAndProxy {

        @Test
        @DisplayName("Basic credentials authenticate and are flagged")
        void basic() throws Exception {
            mockMvc.perform(
                            get("/user")
                                    .header("Authorization", "Basic " + BasicCredentials.encode("bob", "builder-bob")))
                    .andExpect(jsonPath("$.user.name").value("bob"))
                    .andExpect(jsonPath("$.basicAuth").value(true))
                    .andExpect(jsonPath("$.method").value("BASIC"));
        }

        @Test
        @DisplayName("wrong Basic password is anonymous")
        void basicWrongPassword() throws Exception {
            mockMvc.perform(
                            get("/api/v1/user")
                                    .header("Authorization", "Basic " + BasicCredentials.encode("bob", "nope")))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("the reverse proxy header resolves existing users")
        void proxyExistingUser() throws Exception {
            mockMvc.perform(get("/user").header("X-WEBAUTH-USER", "bob"))
                    .andExpect(jsonPath("$.user.name").value("bob"))
                    .andExpect(jsonPath("$.method").value("REVERSE_PROXY"));
        }

        @Test
        @DisplayName("unknown reverse proxy users are auto-registered once")
        void proxyAutoRegister() throws Exception {
            String name = uniqueName();

            var first =
                    mockMvc.perform(get("/user").header("X-WEBAUTH-USER", name))
                            .andExpect(jsonPath("$.user.name").value(name))
                            .andExpect(jsonPath("$.user.email").value(endsWith("@localhost")))
                            .andReturn();
            Integer firstId = JsonPath.read(first.getResponse().getContentAsString(), "$.user.id");

            mockMvc.perform(get("/user").header("X-WEBAUTH-USER", name))
                    .andExpect(jsonPath("$.user.id").value(firstId));
        }
    }
}
