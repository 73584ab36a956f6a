package io.github.drompincen.startpage.gateway.controller;

import io.github.drompincen.startpage.gateway.security.AccessGate;
import io.github.drompincen.startpage.protocol.api.SettingsDto;
import io.github.drompincen.startpage.runtime.InvalidArgumentException;
import io.github.drompincen.startpage.runtime.auth.CredentialService;
import io.github.drompincen.startpage.runtime.auth.IncorrectPasswordException;
import io.github.drompincen.startpage.runtime.auth.UnauthorizedException;
import io.github.drompincen.startpage.runtime.catalog.LinkCatalogService;
import io.github.drompincen.startpage.runtime.catalog.LinkNotFoundException;
import io.github.drompincen.startpage.runtime.settings.SettingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ApiExceptionHandlerTest {

    private static final String ADMIN = "Bearer good";

    @Mock private AccessGate accessGate;
    @Mock private LinkCatalogService catalogService;
    @Mock private SettingsService settingsService;
    @Mock private CredentialService credentialService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new LinkController(accessGate, catalogService),
                        new SettingsController(accessGate, settingsService),
                        new AuthController(accessGate, credentialService),
                        new CategoryController(accessGate, catalogService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
        when(accessGate.requireAdmin(ADMIN)).thenReturn("admin");
        when(accessGate.requireAdmin(null)).thenThrow(new UnauthorizedException("Not authenticated"));
    }

    @Test
    void missingTokenIsUnauthorizedWithBearerChallenge() throws Exception {
        mockMvc.perform(delete("/api/links/1"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.detail").value("Not authenticated"));
        verify(catalogService, never()).delete(anyLong());
    }

    @Test
    void unknownLinkIsNotFound() throws Exception {
        doThrow(new LinkNotFoundException(42L)).when(catalogService).delete(42L);

        mockMvc.perform(delete("/api/links/42").header("Authorization", ADMIN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Link not found"));
    }

    @Test
    void emptyUpdateIsBadRequest() throws Exception {
        when(catalogService.update(eq(3L), any())).thenThrow(new InvalidArgumentException("No fields to update"));

        mockMvc.perform(put("/api/links/3").header("Authorization", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("No fields to update"));
    }

    @Test
    void reorderRouteIsNotTreatedAsLinkId() throws Exception {
        mockMvc.perform(put("/api/links/reorder").header("Authorization", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[{\"id\":5,\"category\":\"A\",\"sort_index\":1}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
        verify(catalogService).reorder(any());
    }

    @Test
    void wrongOldPasswordIsBadRequest() throws Exception {
        doThrow(new IncorrectPasswordException()).when(credentialService).changePassword("wrong", "x");

        mockMvc.perform(post("/api/auth/change-password").header("Authorization", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"old_password\":\"wrong\",\"new_password\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Incorrect old password"));
    }

    @Test
    void changePasswordReturnsMessage() throws Exception {
        mockMvc.perform(post("/api/auth/change-password").header("Authorization", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"old_password\":\"admin123\",\"new_password\":\"x\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Password changed successfully"));
        verify(credentialService).changePassword("admin123", "x");
    }

    @Test
    void loginReturnsBearerToken() throws Exception {
        when(accessGate.login("admin123")).thenReturn("signed.jwt.token");

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"password\":\"admin123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").value("signed.jwt.token"))
                .andExpect(jsonPath("$.token_type").value("bearer"));
    }

    @Test
    void badLoginIsUnauthorized() throws Exception {
        when(accessGate.login("nope")).thenThrow(new UnauthorizedException("Invalid password"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON).content("{\"password\":\"nope\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Invalid password"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/links").header("Authorization", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Malformed request body"));
    }

    @Test
    void nonNumericIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/links/abc/click"))
                .andExpect(status().isBadRequest());
        verify(catalogService, never()).trackClick(anyLong());
    }

    @Test
    void unexpectedFailureHidesInternals() throws Exception {
        when(settingsService.get()).thenThrow(new IllegalStateException("mongo connection string leaked"));

        mockMvc.perform(get("/api/settings"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Internal server error"));
    }

    @Test
    void settingsReadIsPublicAndWriteEchoes() throws Exception {
        when(settingsService.get()).thenReturn(SettingsDto.defaults());
        when(settingsService.put(any())).thenAnswer(inv -> inv.getArgument(0));

        mockMvc.perform(get("/api/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.site_title").value("Aesthetic Nav"));
        mockMvc.perform(put("/api/settings").header("Authorization", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"site_title\":\"T\",\"site_logo\":\"L\",\"hidden_categories\":[\"X\"],\"category_order\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hidden_categories[0]").value("X"));
    }

    @Test
    void categoryOrderEchoes() throws Exception {
        when(catalogService.setCategoryOrder(List.of("B", "A"))).thenReturn(List.of("B", "A"));

        mockMvc.perform(put("/api/categories/order").header("Authorization", ADMIN)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"order\":[\"B\",\"A\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order[0]").value("B"))
                .andExpect(jsonPath("$.order[1]").value("A"));
    }
}
