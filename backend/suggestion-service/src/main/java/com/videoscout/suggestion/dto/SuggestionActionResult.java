package com.videoscout.suggestion.dto;

import com.videoscout.suggestion.entity.SuggestionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionActionResult {

    private Long suggestionId;
    private SuggestionStatus status;
    private boolean alreadyInLibrary;

    /** Approved, but adding the video to the library failed */
    private boolean libraryUpdateFailed;
    private boolean unchanged;
    private String message;
}
