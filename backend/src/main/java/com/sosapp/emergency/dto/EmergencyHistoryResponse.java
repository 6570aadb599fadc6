package com.sosapp.emergency.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyHistoryResponse {

    private List<EmergencyDTO> emergencies;
    private int page;
    private int pageSize;
    private long total;
    private int totalPages;
}
