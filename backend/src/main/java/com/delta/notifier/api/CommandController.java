package com.delta.notifier.api;

import com.delta.notifier.command.CommandDispatcher;
import com.delta.notifier.model.CommandRequest;
import com.delta.notifier.model.CommandResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/commands")
public class CommandController {
    private final CommandDispatcher dispatcher;

    public CommandController(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping
    public CommandResponse handle(@RequestBody CommandRequest request) {
        if (request == null || request.subscriberId() == null || request.subscriberId().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "subscriberId is required");
        }
        List<String> replies = dispatcher.handle(request.subscriberId(), request.text());
        return new CommandResponse(request.subscriberId().trim(), replies);
    }
}
