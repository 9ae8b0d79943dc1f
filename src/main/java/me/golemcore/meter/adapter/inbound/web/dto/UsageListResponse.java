package me.golemcore.meter.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.meter.domain.model.UsageSnapshot;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsageListResponse {
    private List<UsageSnapshot> services;
}
