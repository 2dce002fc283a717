package com.example.funnel.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.funnel.service.EmailJobRunner;
import com.example.funnel.service.NewEmailJob;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(EmailJobController.class)
@Import(ApiExceptionHandler.class)
class EmailJobControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private EmailJobRunner emailJobRunner;

  @Test
  void enqueueIsAccepted() throws Exception {
    final UUID id = UUID.fromString("9c1e3b55-2f7a-4c1d-a3e2-6b0f1d2c3e4f");
    when(emailJobRunner.enqueue(any(NewEmailJob.class))).thenReturn(id);
    final String body =
        """
        {
          "to_email": "ada@example.com",
          "template_key": "receipt",
          "subject": "Thanks {{first_name}}",
          "text": "Hi {{first_name}}",
          "scheduled_at": "2026-03-02T09:00:00Z",
          "variables": {"first_name": "Ada"}
        }
        """;

    mockMvc
        .perform(post("/v1/email-jobs").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.job_id").value(id.toString()));

    final ArgumentCaptor<NewEmailJob> captor = ArgumentCaptor.forClass(NewEmailJob.class);
    verify(emailJobRunner).enqueue(captor.capture());
    assertThat(captor.getValue().templateKey()).isEqualTo("receipt");
    assertThat(captor.getValue().scheduledAt()).isEqualTo(Instant.parse("2026-03-02T09:00:00Z"));
    assertThat(captor.getValue().variables()).containsEntry("first_name", "Ada");
  }

  @Test
  void missingSubjectIsRejected() throws Exception {
    final String body =
        """
        {
          "to_email": "ada@example.com",
          "template_key": "receipt",
          "text": "Hi"
        }
        """;

    mockMvc
        .perform(post("/v1/email-jobs").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("subject is required"));

    verifyNoInteractions(emailJobRunner);
  }

  @Test
  void malformedJsonIsRejected() throws Exception {
    mockMvc
        .perform(post("/v1/email-jobs").contentType(MediaType.APPLICATION_JSON).content("{\"to_email\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is invalid"));
  }
}
