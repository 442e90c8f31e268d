package com.good4it.lendingservice.dto;

import jakarta.validation.constraints.Size;

// Free text that may be omitted: task completion/confirmation notes, cancellation reason, reminder message
public record NotesRequest(@Size(max = 500) String notes) {
}
