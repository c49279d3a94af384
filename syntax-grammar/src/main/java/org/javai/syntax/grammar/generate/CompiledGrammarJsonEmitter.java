package org.javai.syntax.grammar.generate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.syntax.grammar.compile.CompiledGrammar;
import org.javai.syntax.grammar.compile.FieldTarget;

/**
 * Emits a JSON description of a compiled grammar: kinds, definitions and fields.
 * Meant for tooling and for reviewing compiler output in diffs, not for reloading.
 */
public final class CompiledGrammarJsonEmitter {

	private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	private CompiledGrammarJsonEmitter() {}

	public static ObjectNode emit(CompiledGrammar grammar) {
		ObjectNode root = mapper.createObjectNode();

		ArrayNode tokens = root.putArray("tokenKinds");
		grammar.kinds().tokenKinds().forEach(kind -> {
			ObjectNode t = tokens.addObject();
			t.put("id", kind.id());
			t.put("name", kind.name());
			kind.text().ifPresent(text -> t.put("text", text));
			if (kind.trivia()) {
				t.put("trivia", true);
			}
		});

		ArrayNode nodes = root.putArray("nodeKinds");
		grammar.kinds().nodeKinds().forEach(kind -> {
			ObjectNode n = nodes.addObject();
			n.put("id", kind.id());
			n.put("name", kind.name());
		});

		ArrayNode definitions = root.putArray("definitions");
		grammar.definitions().forEach(def -> {
			ObjectNode d = definitions.addObject();
			d.put("name", def.name());
			d.put("kind", def.kind().name());
			d.put("category", def.category().name());
			d.put("rule", def.rule().toString());
			if (def.isSum()) {
				ArrayNode members = d.putArray("members");
				def.members().forEach(members::add);
				ArrayNode memberKinds = d.putArray("memberKinds");
				def.memberKinds().forEach(k -> memberKinds.add(k.name()));
				return;
			}
			ArrayNode fields = d.putArray("fields");
			def.fields().forEach(field -> {
				ObjectNode f = fields.addObject();
				f.put("name", field.name());
				f.put("cardinality", field.cardinality().name());
				f.put("target", field.target().toString());
				ArrayNode accepts = f.putArray("accepts");
				if (field.target() instanceof FieldTarget.Token token) {
					token.kinds().forEach(k -> accepts.add(k.name()));
				} else {
					field.target().nodeKinds().forEach(k -> accepts.add(k.name()));
				}
				if (field.position() > 0) {
					f.put("position", field.position());
				}
				field.childAnchor().ifPresent(anchor -> {
					ObjectNode a = f.putObject("anchor");
					ArrayNode anchorTokens = a.putArray("tokens");
					anchor.tokens().forEach(k -> anchorTokens.add(k.name()));
					a.put("side", anchor.side().name());
					a.put("index", anchor.index());
					a.put("fallback", anchor.fallback());
				});
				f.put("labeled", field.labeled());
			});
		});

		return root;
	}

	public static String emitString(CompiledGrammar grammar) {
		try {
			return mapper.writeValueAsString(emit(grammar));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize compiled grammar", e);
		}
	}
}
