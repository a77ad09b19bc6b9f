package com.delta.notifier.api;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.delta.notifier.source.EntrySource;
import com.delta.notifier.support.TestEntries;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SubscriberEndpointTest {

  @MockBean private EntrySource entrySource;

  @MockBean(name = "subscriptionTaskScheduler")
  private TaskScheduler taskScheduler;

  @Autowired private WebApplicationContext context;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
  }

  @Test
  void subscribeUpdateAndReadBack() throws Exception {
    String id = TestEntries.uniqueId("api");

    mockMvc
        .perform(post("/api/subscribers/{id}", id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subscriberId").value(id))
        .andExpect(jsonPath("$.notifyTime").value("09:00"))
        .andExpect(jsonPath("$.repeatIntervalHours").value(24))
        .andExpect(jsonPath("$.nextFireAt").exists());

    mockMvc
        .perform(put("/api/subscribers/{id}/time", id).param("value", "23:59"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.notifyTime").value("23:59"));

    mockMvc
        .perform(put("/api/subscribers/{id}/frequency", id).param("hours", "6"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.repeatIntervalHours").value(6));

    mockMvc
        .perform(get("/api/subscribers"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].subscriberId", hasItem(id)));
  }

  @Test
  void invalidInputIsBadRequest() throws Exception {
    String id = TestEntries.uniqueId("api-bad");
    mockMvc.perform(post("/api/subscribers/{id}", id)).andExpect(status().isOk());

    mockMvc
        .perform(put("/api/subscribers/{id}/time", id).param("value", "25:99"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_format"));

    mockMvc
        .perform(put("/api/subscribers/{id}/frequency", id).param("hours", "0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_value"));

    mockMvc
        .perform(post("/api/subscribers/{id}/updates", id).param("count", "0"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unknownSubscriberIsNotFound() throws Exception {
    String id = TestEntries.uniqueId("api-ghost");

    mockMvc
        .perform(get("/api/subscribers/{id}", id))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("subscriber_not_found"))
        .andExpect(jsonPath("$.message", containsString(id)));

    mockMvc
        .perform(put("/api/subscribers/{id}/time", id).param("value", "10:00"))
        .andExpect(status().isNotFound());

    mockMvc.perform(post("/api/subscribers/{id}/cycle", id)).andExpect(status().isNotFound());
  }

  @Test
  void cycleAndOnDemandWriteToOutbox() throws Exception {
    String id = TestEntries.uniqueId("api-cycle");
    when(entrySource.fetchEntries())
        .thenReturn(List.of(TestEntries.entry("Acme", "Intern"), TestEntries.entry("Beta", "Intern")));
    mockMvc.perform(post("/api/subscribers/{id}", id)).andExpect(status().isOk());

    mockMvc
        .perform(post("/api/subscribers/{id}/cycle", id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DELIVERED"))
        .andExpect(jsonPath("$.newEntries").value(2));

    mockMvc
        .perform(post("/api/subscribers/{id}/updates", id).param("count", "120"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.capped").value(true))
        .andExpect(jsonPath("$.effectiveCount").value(50))
        .andExpect(jsonPath("$.entriesDelivered").value(2));

    mockMvc
        .perform(get("/api/subscribers/{id}/messages", id).param("limit", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].kind").value("ON_DEMAND"))
        .andExpect(jsonPath("$[1].kind").value("SCHEDULED"))
        .andExpect(jsonPath("$[1].body", containsString("*Company*: Acme")));
  }

  @Test
  void unsubscribeIsIdempotent() throws Exception {
    String id = TestEntries.uniqueId("api-bye");
    mockMvc.perform(post("/api/subscribers/{id}", id)).andExpect(status().isOk());

    mockMvc.perform(delete("/api/subscribers/{id}", id)).andExpect(status().isNoContent());
    mockMvc.perform(delete("/api/subscribers/{id}", id)).andExpect(status().isNoContent());
    mockMvc.perform(get("/api/subscribers/{id}", id)).andExpect(status().isNotFound());
  }
}
