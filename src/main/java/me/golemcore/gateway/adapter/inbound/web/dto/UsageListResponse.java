package me.golemcore.gateway.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.gateway.domain.model.UsageRecord;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageListResponse {
    private List<UsageRecord> items;
    private int count;
}
