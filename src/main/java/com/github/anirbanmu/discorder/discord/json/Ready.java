package com.github.anirbanmu.discorder.discord.json;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import java.util.List;

// READY dispatch data
@CompiledJson
public record Ready(int v, User user, @JsonAttribute(nullable = true) List<UnavailableGuild> guilds, @JsonAttribute(name = "session_id") String sessionId, @JsonAttribute(name = "resume_gateway_url", nullable = true) String resumeGatewayUrl) {
}
