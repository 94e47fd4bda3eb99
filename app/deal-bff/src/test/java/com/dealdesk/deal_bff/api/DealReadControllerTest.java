package com.dealdesk.deal_bff.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.dealdesk.deal_bff.service.AuthorityIntegrationException;
import com.dealdesk.deal_bff.service.DealReadService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DealReadController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(BffApiExceptionHandler.class)
class DealReadControllerTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Autowired private MockMvc mockMvc;

  @MockitoBean private DealReadService dealReadService;

  @Test
  void snapshotReturns200() throws Exception {
    when(dealReadService.getSnapshot("D1"))
        .thenReturn(objectMapper.createObjectNode().put("dealId", "D1").put("stage", "Review"));

    mockMvc
        .perform(get("/api/deals/D1/snapshot"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.stage").value("Review"));
  }

  @Test
  void eventsReturnAuthorityList() throws Exception {
    when(dealReadService.getAuthorityEvents("D1"))
        .thenReturn(
            objectMapper.createArrayNode().add(objectMapper.createObjectNode().put("id", "e1")));

    mockMvc
        .perform(get("/api/deals/D1/events"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("e1"));
  }

  @Test
  void invalidAuthorityResponseReturns502() throws Exception {
    when(dealReadService.getSnapshot("D1"))
        .thenThrow(
            new AuthorityIntegrationException(
                AuthorityIntegrationException.Reason.INVALID_RESPONSE, "empty", null));

    mockMvc
        .perform(get("/api/deals/D1/snapshot"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("AUTHORITY_INVALID_RESPONSE"));
  }
}
