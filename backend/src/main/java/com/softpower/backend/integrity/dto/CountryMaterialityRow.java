package com.softpower.backend.integrity.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CountryMaterialityRow {
    private String country;
    private Long total;
    private Long scored;
}
