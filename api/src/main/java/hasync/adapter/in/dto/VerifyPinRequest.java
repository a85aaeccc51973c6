package hasync.adapter.in.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * DTO for the public PIN verification request.
 *
 * @param pin        the six digit PIN shown to the administrator
 * @param deviceName name of the device being paired
 * @param deviceType mobile, tablet, desktop or other
 * @param sessionId  optional session the device expects to pair with
 */
public record VerifyPinRequest(
        @NotBlank String pin,
        @Size(max = 128) String deviceName,
        String deviceType,
        String sessionId) {

    @Override
    public String toString() {
        return "VerifyPinRequest[pin=******, deviceName=" + deviceName + ", deviceType=" + deviceType
                + ", sessionId=" + sessionId + "]";
    }
}
