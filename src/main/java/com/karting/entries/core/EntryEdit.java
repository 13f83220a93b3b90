package com.karting.entries.core;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Admin change to an existing entry. Null fields are left as they are. */
@Value
@Builder
public class EntryEdit {

    String raceClass;
    List<String> items;
    String teamCode;
    String actor;
}
