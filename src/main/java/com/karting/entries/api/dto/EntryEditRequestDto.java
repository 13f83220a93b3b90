package com.karting.entries.api.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/** Omitted fields are left unchanged. */
@Data
public class EntryEditRequestDto {

    @Size(max = 50)
    private String raceClass;

    private List<String> items;

    @Size(max = 50)
    private String teamCode;
}
